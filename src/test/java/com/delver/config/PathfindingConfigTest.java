package com.delver.config;

import org.junit.Test;

import static org.junit.Assert.*;

public class PathfindingConfigTest {

    private static final double EPSILON = 1e-9;

    @Test
    public void testDefaults() {
        PathfindingConfig config = PathfindingConfig.DEFAULT;

        assertEquals(32, config.getTileSize());
        assertEquals(500, config.getMaxExpansions());
        assertEquals(20, config.getMaxWaypoints());
        assertEquals(1.5, config.getWallClearance(), EPSILON);
        assertEquals(0.5, config.getDoorwayClearance(), EPSILON);
        assertEquals(2, config.getWallPenaltyRadius());
        assertEquals(3, config.getStuckThreshold());
        assertEquals(8, config.getEscapeMaxDistance());
        assertEquals(5, config.getOpenSpaceNeighbours());
        assertEquals(8.0, config.getArrivalRadius(), EPSILON);
    }

    @Test
    public void testWithTileSize_ScalesArrivalRadius() {
        PathfindingConfig small = PathfindingConfig.DEFAULT.withTileSize(16);

        assertEquals(16, small.getTileSize());
        assertEquals(4.0, small.getArrivalRadius(), EPSILON);
        assertEquals(PathfindingConfig.DEFAULT.getMaxExpansions(), small.getMaxExpansions());
    }

    @Test
    public void testToBuilder_LeavesOriginalUntouched() {
        PathfindingConfig changed = PathfindingConfig.DEFAULT.toBuilder().maxExpansions(50).build();

        assertEquals(50, changed.getMaxExpansions());
        assertEquals(500, PathfindingConfig.DEFAULT.getMaxExpansions());
        assertNotEquals(PathfindingConfig.DEFAULT, changed);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsZeroTileSize() {
        PathfindingConfig.DEFAULT.toBuilder().tileSize(0).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveExpansionCap() {
        PathfindingConfig.DEFAULT.toBuilder().maxExpansions(0).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNegativeClearance() {
        PathfindingConfig.DEFAULT.toBuilder().wallClearance(-0.1).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsStuckThresholdAboveEight() {
        PathfindingConfig.DEFAULT.toBuilder().stuckThreshold(9).build();
    }
}
