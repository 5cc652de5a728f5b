package com.delver.navigation;

import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

/**
 * Tests for TileCostModel doorway detection and wall penalties.
 */
public class TileCostModelTest {

    private static final double EPSILON = 1e-9;

    @Mock
    private TileMap mockMap;

    private TileCostModel costModel;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        costModel = new TileCostModel();
    }

    // ========================================================================
    // isDoorway Tests
    // ========================================================================

    @Test
    public void testIsDoorway_CorridorThroughWall_ReturnsTrue() {
        GridTileMap map = GridTileMap.fromRows(
                "#.#",
                "#.#",
                "#.#");

        assertTrue("Centre of a N-S corridor is a doorway", costModel.isDoorway(map, 1, 1));
    }

    @Test
    public void testIsDoorway_HorizontalPassage_ReturnsTrue() {
        GridTileMap map = GridTileMap.fromRows(
                "###",
                "...",
                "###");

        assertTrue("Centre of an E-W passage is a doorway", costModel.isDoorway(map, 1, 1));
    }

    @Test
    public void testIsDoorway_OpenFloor_ReturnsFalse() {
        GridTileMap map = GridTileMap.fromRows(
                "...",
                "...",
                "...");

        assertFalse(costModel.isDoorway(map, 1, 1));
    }

    @Test
    public void testIsDoorway_WallTile_ReturnsFalse() {
        GridTileMap map = GridTileMap.fromRows(
                "#.#",
                "###",
                "#.#");

        assertFalse("A wall is never a doorway", costModel.isDoorway(map, 1, 1));
    }

    @Test
    public void testIsDoorway_SealedCell_ReturnsFalse() {
        GridTileMap map = GridTileMap.fromRows(
                "###",
                "#.#",
                "###");

        assertFalse("Walls on both axes is a sealed cell", costModel.isDoorway(map, 1, 1));
    }

    @Test
    public void testIsDoorway_SingleWallSide_ReturnsFalse() {
        GridTileMap map = GridTileMap.fromRows(
                "...",
                "#..",
                "...");

        assertFalse(costModel.isDoorway(map, 1, 1));
    }

    @Test
    public void testIsDoorway_ReadsMapLive() {
        when(mockMap.isWalkable(anyInt(), anyInt())).thenReturn(true);
        assertFalse(costModel.isDoorway(mockMap, 4, 4));

        // Walls appear east and west of (4, 4)
        when(mockMap.isWalkable(5, 4)).thenReturn(false);
        when(mockMap.isWalkable(3, 4)).thenReturn(false);
        assertTrue("Doorway status must follow map changes", costModel.isDoorway(mockMap, 4, 4));
    }

    // ========================================================================
    // wallPenalty Tests
    // ========================================================================

    @Test
    public void testWallPenalty_OpenSpace_Zero() {
        GridTileMap map = new GridTileMap(9, 9);
        assertEquals(0.0, costModel.wallPenalty(map, 4, 4), EPSILON);
    }

    @Test
    public void testWallPenalty_OrthogonalWall_FlatPenalty() {
        GridTileMap map = new GridTileMap(9, 9);
        map.setWalkable(5, 4, false);

        assertEquals("Adjacent wall costs the flat penalty", 2.0, costModel.wallPenalty(map, 4, 4), EPSILON);
    }

    @Test
    public void testWallPenalty_DiagonalWall_InverseDistance() {
        GridTileMap map = new GridTileMap(9, 9);
        map.setWalkable(5, 5, false);

        assertEquals(1.0 / Math.sqrt(2.0), costModel.wallPenalty(map, 4, 4), EPSILON);
    }

    @Test
    public void testWallPenalty_WallTwoTilesAway_InverseDistance() {
        GridTileMap map = new GridTileMap(9, 9);
        map.setWalkable(6, 4, false);
        map.setWalkable(6, 6, false);

        double expected = 0.5 + 1.0 / Math.sqrt(8.0);
        assertEquals(expected, costModel.wallPenalty(map, 4, 4), EPSILON);
    }

    @Test
    public void testWallPenalty_OutsideRadius_Ignored() {
        GridTileMap map = new GridTileMap(9, 9);
        map.setWalkable(7, 4, false);

        assertEquals(0.0, costModel.wallPenalty(map, 4, 4), EPSILON);
        assertEquals("Radius 3 reaches the wall", 1.0 / 3.0, costModel.wallPenalty(map, 4, 4, 3), EPSILON);
    }

    @Test
    public void testWallPenalty_Doorway_ReducedAdjacentPenalty() {
        GridTileMap map = GridTileMap.fromRows(
                ".....",
                ".....",
                ".....",
                ".#.#.",
                ".....",
                ".....",
                ".....");

        assertTrue(costModel.isDoorway(map, 2, 3));
        assertEquals("Doorway walls cost 0.5 each", 1.0, costModel.wallPenalty(map, 2, 3), EPSILON);

        // Tile above the doorway sees the same walls diagonally
        assertFalse(costModel.isDoorway(map, 2, 2));
        assertEquals(2.0 / Math.sqrt(2.0), costModel.wallPenalty(map, 2, 2), EPSILON);
    }

    @Test
    public void testWallPenalty_MapEdgeCountsAsWall() {
        GridTileMap map = new GridTileMap(3, 3);

        // (0, 1): west neighbour is out of range
        assertTrue("Out-of-range tiles add penalty", costModel.wallPenalty(map, 0, 1) > 2.0);
    }

    // ========================================================================
    // effectiveClearance / countBlockedNeighbours Tests
    // ========================================================================

    @Test
    public void testEffectiveClearance_DoorwayEndpoint() {
        GridTileMap map = GridTileMap.fromRows(
                ".....",
                ".....",
                ".....",
                ".#.#.",
                ".....",
                ".....",
                ".....");

        assertEquals(0.5, costModel.effectiveClearance(map, 2, 2, 2, 3, 1.5), EPSILON);
        assertEquals(0.5, costModel.effectiveClearance(map, 2, 3, 2, 4, 1.5), EPSILON);
        assertEquals(1.5, costModel.effectiveClearance(map, 0, 0, 1, 0, 1.5), EPSILON);
    }

    @Test
    public void testCountBlockedNeighbours() {
        GridTileMap map = GridTileMap.fromRows(
                "#..",
                "...",
                "..#");

        assertEquals(2, costModel.countBlockedNeighbours(map, 1, 1));
        assertEquals("Corner tile has 5 out-of-range neighbours",
                5, costModel.countBlockedNeighbours(map, 0, 0));
    }
}
