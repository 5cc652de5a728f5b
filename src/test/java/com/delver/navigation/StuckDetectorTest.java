package com.delver.navigation;

import com.delver.config.PathfindingConfig;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * Tests for StuckDetector classification and escape routing.
 *
 * <p>Verifies:
 * <ul>
 *   <li>Threshold and corner stuck detection</li>
 *   <li>Escape toward the exit of a dead-end pocket</li>
 *   <li>Emergency one-tile step when the ring search finds nothing</li>
 *   <li>Null for a sealed cell</li>
 * </ul>
 */
public class StuckDetectorTest {

    private static final int TILE = PathfindingConfig.TILE_SIZE;

    private StuckDetector stuckDetector;

    @Before
    public void setUp() {
        stuckDetector = new StuckDetector();
    }

    // ========================================================================
    // isStuck Tests
    // ========================================================================

    @Test
    public void testIsStuck_OpenTile_ReturnsFalse() {
        GridTileMap map = new GridTileMap(5, 5);
        assertFalse(stuckDetector.isStuck(map, 2, 2));
    }

    @Test
    public void testIsStuck_EnclosedOnThreeSides_ReturnsTrue() {
        GridTileMap map = GridTileMap.fromRows(
                ".....",
                "..#..",
                ".#.#.",
                ".....",
                ".....");

        assertTrue("3 blocked neighbours reach the threshold", stuckDetector.isStuck(map, 2, 2));
    }

    @Test
    public void testIsStuck_TwoWallCorner_ReturnsTrue() {
        GridTileMap map = GridTileMap.fromRows(
                ".....",
                "..#..",
                ".#...",
                ".....",
                ".....");

        assertEquals(2, new TileCostModel().countBlockedNeighbours(map, 2, 2));
        assertTrue("North and west walls form a corner", stuckDetector.isStuck(map, 2, 2));
    }

    @Test
    public void testIsStuck_TwoOppositeWalls_NotCorner() {
        GridTileMap map = GridTileMap.fromRows(
                ".....",
                "..#..",
                ".....",
                "..#..",
                ".....");

        assertFalse("North and south walls are not a corner", stuckDetector.isStuck(map, 2, 2));
    }

    @Test
    public void testIsStuck_CustomThreshold() {
        GridTileMap map = GridTileMap.fromRows(
                ".....",
                ".#.#.",
                ".....",
                ".....",
                ".....");

        assertFalse("2 diagonal walls stay under the default threshold", stuckDetector.isStuck(map, 2, 2));
        assertTrue("Threshold 2 is reached", stuckDetector.isStuck(map, 2, 2, 2));
    }

    @Test
    public void testIsStuck_MapCornerIsStuck() {
        GridTileMap map = new GridTileMap(5, 5);
        assertTrue("Map edges behave as walls", stuckDetector.isStuck(map, 0, 0));
    }

    // ========================================================================
    // findEscapePath Tests
    // ========================================================================

    @Test
    public void testFindEscapePath_DeadEndPocket_LeadsToExit() {
        GridTileMap map = GridTileMap.fromRows(
                "#######",
                "###.###",
                "#.....#",
                "#.....#",
                "#.....#",
                "#######");

        assertTrue(stuckDetector.isStuck(map, 3, 1));

        List<Waypoint> escape = stuckDetector.findEscapePath(map, 3, 1);

        assertNotNull("Pocket with an exit must have an escape", escape);
        assertEquals("Escape path has exactly two waypoints", 2, escape.size());
        assertEquals(Waypoint.tileCenter(3, 1, TILE), escape.get(0));
        assertEquals("Escape goes through the pocket exit", Waypoint.tileCenter(3, 2, TILE), escape.get(1));
    }

    @Test
    public void testFindEscapePath_SealedCell_ReturnsNull() {
        GridTileMap map = GridTileMap.fromRows(
                "###",
                "#.#",
                "###");

        assertNull(stuckDetector.findEscapePath(map, 1, 1));
    }

    @Test
    public void testFindEscapePath_EscapeTileIsNotStuck() {
        GridTileMap map = GridTileMap.fromRows(
                "##########",
                "#.#......#",
                "#.#......#",
                "#........#",
                "##########");

        List<Waypoint> escape = stuckDetector.findEscapePath(map, 1, 1);

        assertNotNull(escape);
        TilePoint chosen = escape.get(1).toTile(TILE);
        assertTrue(map.isWalkable(chosen.x(), chosen.y()));
        assertFalse("Escape must not lead into another stuck tile",
                stuckDetector.isStuck(map, chosen.x(), chosen.y()));
    }

    @Test
    public void testFindEscapePath_EmergencyDiagonalStep() {
        GridTileMap map = GridTileMap.fromRows(
                "######",
                "#....#",
                "##...#",
                "#....#",
                "######");

        assertTrue(stuckDetector.isStuck(map, 1, 1));
        assertTrue("Only orthogonal exit is itself stuck", stuckDetector.isStuck(map, 2, 1));

        // Ring 1 holds only the orthogonal neighbours, so the diagonal comes from the emergency step
        List<Waypoint> escape = stuckDetector.findEscapePath(map, 1, 1, 1);

        assertNotNull(escape);
        assertEquals(2, escape.size());
        assertEquals(Waypoint.tileCenter(2, 2, TILE), escape.get(1));
    }

    @Test
    public void testFindEscapePath_PrefersNearestOpenSpace() {
        GridTileMap map = GridTileMap.fromRows(
                "######",
                "#....#",
                "##...#",
                "#....#",
                "######");

        List<Waypoint> escape = stuckDetector.findEscapePath(map, 1, 1);

        assertNotNull(escape);
        assertEquals(Waypoint.tileCenter(2, 2, TILE), escape.get(1));
    }

    @Test
    public void testFindEscapePath_UsesConfiguredTileSize() {
        StuckDetector small = new StuckDetector(new TileCostModel(PathfindingConfig.DEFAULT.withTileSize(16)));
        GridTileMap map = GridTileMap.fromRows(
                "#######",
                "###.###",
                "#.....#",
                "#.....#",
                "#.....#",
                "#######");

        List<Waypoint> escape = small.findEscapePath(map, 3, 1);

        assertNotNull(escape);
        assertEquals(new Waypoint(56, 24), escape.get(0));
        assertEquals(new Waypoint(56, 40), escape.get(1));
    }
}
