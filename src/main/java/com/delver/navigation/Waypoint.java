package com.delver.navigation;

/**
 * A pixel-space point on a path. Waypoints produced by the pathfinder sit at tile
 * centres.
 *
 * @param x pixel x
 * @param y pixel y
 */
public record Waypoint(double x, double y) {

    /**
     * Centre of a tile. The half tile is rounded down for odd tile sizes.
     *
     * @param tile     the tile
     * @param tileSize tile edge length in pixels
     * @return centre waypoint
     */
    public static Waypoint tileCenter(TilePoint tile, int tileSize) {
        return tileCenter(tile.x(), tile.y(), tileSize);
    }

    public static Waypoint tileCenter(int tileX, int tileY, int tileSize) {
        int half = tileSize / 2;
        return new Waypoint(tileX * tileSize + half, tileY * tileSize + half);
    }

    public TilePoint toTile(int tileSize) {
        return TilePoint.fromPixel(x, y, tileSize);
    }

    public double distanceTo(Waypoint other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
