package com.delver.navigation;

/**
 * Walkability source queried by the pathfinding code.
 *
 * <p>Implementations must answer for any integer coordinate and return {@code false}
 * for tiles outside the map. The navigation classes only read from the map.
 */
@FunctionalInterface
public interface TileMap {

    /**
     * Check whether a tile can be stood on.
     *
     * @param tileX tile column
     * @param tileY tile row
     * @return true if the tile is floor, false for walls and out-of-range tiles
     */
    boolean isWalkable(int tileX, int tileY);
}
