package com.delver.navigation;

/**
 * Neighbour offsets on the tile grid. Screen orientation: y grows downwards.
 */
final class Directions {

    /**
     * N, NE, E, SE, S, SW, W, NW
     */
    static final int[][] ALL = {
            {0, -1},  // N
            {1, -1},  // NE
            {1, 0},   // E
            {1, 1},   // SE
            {0, 1},   // S
            {-1, 1},  // SW
            {-1, 0},  // W
            {-1, -1}  // NW
    };

    /**
     * Quadrant pairs of orthogonal offsets, used for corner detection.
     */
    static final int[][][] CORNERS = {
            {{1, 0}, {0, 1}},
            {{1, 0}, {0, -1}},
            {{-1, 0}, {0, 1}},
            {{-1, 0}, {0, -1}}
    };

    private Directions() {
    }

    static boolean isDiagonal(int[] direction) {
        return direction[0] != 0 && direction[1] != 0;
    }
}
