package com.delver.navigation;

/**
 * Integer address of a map tile.
 *
 * @param x tile column
 * @param y tile row
 */
public record TilePoint(int x, int y) {

    /**
     * Tile containing a pixel position. Uses floor division, so negative pixels map
     * to negative tiles.
     *
     * @param pixelX   pixel x
     * @param pixelY   pixel y
     * @param tileSize tile edge length in pixels
     * @return the containing tile
     */
    public static TilePoint fromPixel(double pixelX, double pixelY, int tileSize) {
        return new TilePoint((int) Math.floor(pixelX / tileSize), (int) Math.floor(pixelY / tileSize));
    }

    public TilePoint translate(int dx, int dy) {
        return new TilePoint(x + dx, y + dy);
    }

    public int manhattanDistance(TilePoint other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    /**
     * Chebyshev (king move) distance.
     */
    public int chebyshevDistance(TilePoint other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    public boolean isWalkable(TileMap map) {
        return map.isWalkable(x, y);
    }
}
