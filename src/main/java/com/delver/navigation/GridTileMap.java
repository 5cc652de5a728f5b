package com.delver.navigation;

import lombok.Getter;

import java.util.Arrays;

/**
 * Array-backed {@link TileMap}.
 *
 * <p>Each cell holds {@link #FLOOR} or {@link #WALL}. Tiles outside the grid are walls.
 * The grid can be edited in place (doors opening, rubble) and the pathfinder always
 * reads its current state.
 */
public class GridTileMap implements TileMap {

    public static final int FLOOR = 0;
    public static final int WALL = 1;

    @Getter
    private final int width;

    @Getter
    private final int height;

    // indexed [y][x]
    private final int[][] grid;

    /**
     * Create an all-floor map.
     *
     * @param width  columns
     * @param height rows
     */
    public GridTileMap(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Map size must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.grid = new int[height][width];
    }

    /**
     * Build a map from text rows, {@code #} for walls and any other character for floor.
     * Row 0 is the top of the map (tile y = 0).
     *
     * @param rows map rows, all the same length
     * @return the map
     */
    public static GridTileMap fromRows(String... rows) {
        if (rows == null || rows.length == 0) {
            throw new IllegalArgumentException("At least one row is required");
        }
        int width = rows[0].length();
        GridTileMap map = new GridTileMap(width, rows.length);
        for (int y = 0; y < rows.length; y++) {
            String row = rows[y];
            if (row.length() != width) {
                throw new IllegalArgumentException("Row " + y + " has length " + row.length()
                        + ", expected " + width);
            }
            for (int x = 0; x < width; x++) {
                map.grid[y][x] = row.charAt(x) == '#' ? WALL : FLOOR;
            }
        }
        return map;
    }

    @Override
    public boolean isWalkable(int tileX, int tileY) {
        if (isInBounds(tileX, tileY)) {
            return grid[tileY][tileX] == FLOOR;
        }
        return false;
    }

    /**
     * Check if a tile is a wall. Out-of-range tiles count as walls.
     */
    public boolean isWall(int tileX, int tileY) {
        if (isInBounds(tileX, tileY)) {
            return grid[tileY][tileX] == WALL;
        }
        return true;
    }

    /**
     * In bounds and not a wall.
     */
    public boolean isValidPosition(int tileX, int tileY) {
        return isInBounds(tileX, tileY) && !isWall(tileX, tileY);
    }

    public boolean isInBounds(int tileX, int tileY) {
        return tileX >= 0 && tileX < width && tileY >= 0 && tileY < height;
    }

    public void setWalkable(int tileX, int tileY, boolean walkable) {
        if (!isInBounds(tileX, tileY)) {
            throw new IndexOutOfBoundsException("Tile (" + tileX + ", " + tileY + ") outside "
                    + width + "x" + height + " map");
        }
        grid[tileY][tileX] = walkable ? FLOOR : WALL;
    }

    /**
     * Fill a rectangle of tiles, bounds inclusive.
     */
    public void fill(int fromX, int fromY, int toX, int toY, boolean walkable) {
        for (int y = Math.min(fromY, toY); y <= Math.max(fromY, toY); y++) {
            for (int x = Math.min(fromX, toX); x <= Math.max(fromX, toX); x++) {
                setWalkable(x, y, walkable);
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int[] row : grid) {
            for (int cell : row) {
                sb.append(cell == WALL ? '#' : '.');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridTileMap other = (GridTileMap) o;
        return width == other.width && height == other.height && Arrays.deepEquals(grid, other.grid);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.deepHashCode(grid);
    }
}
