package com.delver.navigation;

import com.delver.config.PathfindingConfig;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Turns tile walkability into traversal cost.
 *
 * <p>Used by {@link PathFinder} and {@link PathSmoother} to keep monsters off walls
 * without making corridors unusable:
 * <ul>
 *   <li>Doorway detection (walkable tile pinched between walls on one axis)</li>
 *   <li>Wall penalty: a surcharge that grows with nearby walls</li>
 *   <li>Effective clearance: the multiplier applied to that surcharge</li>
 * </ul>
 *
 * <p>All queries read the map live; nothing is cached between calls.
 *
 * @see PathFinder
 * @see StuckDetector
 */
@Singleton
public class TileCostModel {

    private final PathfindingConfig config;

    public TileCostModel() {
        this(PathfindingConfig.DEFAULT);
    }

    @Inject
    public TileCostModel(PathfindingConfig config) {
        this.config = config;
    }

    /**
     * Check if a tile is a doorway.
     *
     * <p>A doorway is walkable and has walls on both sides along exactly one axis:
     * east and west blocked, or north and south blocked, but not both pairs.
     * A tile walled in on all four sides is a sealed cell, not a doorway.
     *
     * @param map the tile map
     * @param x   tile x
     * @param y   tile y
     * @return true if the tile is a doorway
     */
    public boolean isDoorway(TileMap map, int x, int y) {
        if (!map.isWalkable(x, y)) {
            return false;
        }
        boolean horizontalPinch = !map.isWalkable(x + 1, y) && !map.isWalkable(x - 1, y);
        boolean verticalPinch = !map.isWalkable(x, y + 1) && !map.isWalkable(x, y - 1);
        return horizontalPinch != verticalPinch;
    }

    /**
     * Wall penalty with the configured scan radius.
     *
     * @see #wallPenalty(TileMap, int, int, int)
     */
    public double wallPenalty(TileMap map, int x, int y) {
        return wallPenalty(map, x, y, config.getWallPenaltyRadius());
    }

    /**
     * Compute the wall proximity surcharge of a tile.
     *
     * <p>Every non-walkable tile in the square of half-width {@code radius} around
     * (x, y) contributes:
     * <ul>
     *   <li>a flat penalty when it is orthogonally adjacent (reduced when (x, y)
     *       is a doorway)</li>
     *   <li>{@code 1 / distance} otherwise</li>
     * </ul>
     *
     * @param map    the tile map
     * @param x      tile x
     * @param y      tile y
     * @param radius scan half-width in tiles
     * @return penalty, 0 in open space
     */
    public double wallPenalty(TileMap map, int x, int y, int radius) {
        boolean doorway = isDoorway(map, x, y);
        double adjacentPenalty = doorway ? config.getDoorwayWallPenalty() : config.getAdjacentWallPenalty();
        double penalty = 0.0;

        for (int dx = -radius; dx <= radius; dx++) {
            for (int dy = -radius; dy <= radius; dy++) {
                if (dx == 0 && dy == 0) {
                    continue;
                }
                if (map.isWalkable(x + dx, y + dy)) {
                    continue;
                }
                if (Math.abs(dx) + Math.abs(dy) == 1) {
                    penalty += adjacentPenalty;
                } else {
                    penalty += 1.0 / Math.sqrt(dx * dx + dy * dy);
                }
            }
        }
        return penalty;
    }

    /**
     * Clearance multiplier for a move between two tiles: the doorway clearance if
     * either end is a doorway, otherwise {@code wallClearance}.
     */
    public double effectiveClearance(TileMap map, int fromX, int fromY, int toX, int toY, double wallClearance) {
        if (isDoorway(map, fromX, fromY) || isDoorway(map, toX, toY)) {
            return config.getDoorwayClearance();
        }
        return wallClearance;
    }

    /**
     * Count non-walkable tiles among the 8 neighbours.
     */
    public int countBlockedNeighbours(TileMap map, int x, int y) {
        int blocked = 0;
        for (int[] d : Directions.ALL) {
            if (!map.isWalkable(x + d[0], y + d[1])) {
                blocked++;
            }
        }
        return blocked;
    }

    PathfindingConfig getConfig() {
        return config;
    }
}
