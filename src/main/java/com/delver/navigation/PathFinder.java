package com.delver.navigation;

import com.delver.config.PathfindingConfig;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Weighted A* pathfinding on the tile grid for pursuing monsters.
 *
 * <p>Features:
 * <ul>
 *   <li>8-directional movement, no corner cutting past walls</li>
 *   <li>Edge costs inflated by wall proximity, relaxed in doorways</li>
 *   <li>Stuck start tiles short-circuit to an escape path</li>
 *   <li>Unwalkable targets are moved to a walkable neighbour</li>
 *   <li>Expansion budget (500 by default); running out is a normal failure</li>
 *   <li>Raw paths are pruned by {@link PathSmoother#optimizePath}</li>
 * </ul>
 *
 * <p>The Euclidean heuristic is not consistent with wall-inflated costs, so paths are
 * not guaranteed optimal. That trade is intended.
 *
 * <p>Every call is independent: no state survives between calls. A failed search
 * returns {@code null} and the caller should fall back to moving straight at the
 * target. Expected usage is one search per agent per second or so, not per frame.
 */
@Slf4j
@Singleton
public class PathFinder {

    private static final double DIAGONAL_COST = Math.sqrt(2.0);

    private final PathfindingConfig config;
    private final TileCostModel costModel;
    private final StuckDetector stuckDetector;
    private final PathSmoother pathSmoother;

    public PathFinder() {
        this(PathfindingConfig.DEFAULT);
    }

    public PathFinder(PathfindingConfig config) {
        this(new TileCostModel(config));
    }

    private PathFinder(TileCostModel costModel) {
        this(costModel, new StuckDetector(costModel), new PathSmoother(costModel));
    }

    @Inject
    public PathFinder(TileCostModel costModel, StuckDetector stuckDetector, PathSmoother pathSmoother) {
        this.config = costModel.getConfig();
        this.costModel = costModel;
        this.stuckDetector = stuckDetector;
        this.pathSmoother = pathSmoother;
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Find a path with the configured waypoint cap and wall clearance.
     *
     * @see #findPath(TileMap, Waypoint, Waypoint, int, double)
     */
    @Nullable
    public List<Waypoint> findPath(TileMap map, Waypoint start, Waypoint target) {
        return findPath(map, start, target, config.getMaxWaypoints(), config.getWallClearance());
    }

    /**
     * Find a path from start to target.
     *
     * <ol>
     *   <li>If the start tile is stuck, the escape path is returned when one exists.</li>
     *   <li>An unwalkable target tile is replaced by its first walkable neighbour.</li>
     *   <li>Same start and target tile gives a single-point path at the start.</li>
     *   <li>Otherwise weighted A*, pruned and cut to {@code maxDistance} waypoints.</li>
     * </ol>
     *
     * @param map           the tile map
     * @param start         start position in pixels
     * @param target        target position in pixels
     * @param maxDistance   maximum number of waypoints returned
     * @param wallClearance multiplier on the wall penalty away from doorways
     * @return waypoints at tile centres (start first), or null if no path was found
     */
    @Nullable
    public List<Waypoint> findPath(TileMap map, Waypoint start, Waypoint target,
                                   int maxDistance, double wallClearance) {
        if (map == null || start == null || target == null) {
            log.warn("PathFinder: null map, start or target");
            return null;
        }

        int tileSize = config.getTileSize();
        TilePoint startTile = start.toTile(tileSize);
        TilePoint targetTile = target.toTile(tileSize);

        if (stuckDetector.isStuck(map, startTile.x(), startTile.y())) {
            List<Waypoint> escape = stuckDetector.findEscapePath(map, startTile.x(), startTile.y());
            if (escape != null) {
                log.debug("PathFinder: start {} is stuck, returning escape path {}", startTile, escape);
                return escape;
            }
            log.debug("PathFinder: start {} is stuck with no escape, searching anyway", startTile);
        }

        if (!targetTile.isWalkable(map)) {
            TilePoint retarget = firstWalkableNeighbour(map, targetTile);
            if (retarget == null) {
                log.debug("PathFinder: target {} and its neighbours are unwalkable", targetTile);
                return null;
            }
            log.debug("PathFinder: target {} unwalkable, retargeting to {}", targetTile, retarget);
            targetTile = retarget;
        }

        if (startTile.equals(targetTile)) {
            return Collections.singletonList(start);
        }

        List<TilePoint> tiles = runAStar(map, startTile, targetTile, wallClearance);
        if (tiles == null) {
            return null;
        }

        List<Waypoint> raw = new ArrayList<>(tiles.size());
        for (TilePoint tile : tiles) {
            raw.add(Waypoint.tileCenter(tile, tileSize));
        }

        List<Waypoint> path = pathSmoother.optimizePath(map, raw, wallClearance);
        int limit = Math.max(1, maxDistance);
        if (path.size() > limit) {
            log.debug("PathFinder: path has {} waypoints, limiting to {}", path.size(), limit);
            path = path.subList(0, limit);
        } else {
            log.debug("PathFinder: found path with {} waypoints ({} raw) from {} to {}",
                    path.size(), raw.size(), startTile, targetTile);
        }
        return List.copyOf(path);
    }

    /**
     * Check whether a path can be found between two pixel positions.
     */
    public boolean hasPath(TileMap map, Waypoint start, Waypoint target) {
        return findPath(map, start, target) != null;
    }

    /**
     * @see StuckDetector#findEscapePath(TileMap, int, int, int)
     */
    @Nullable
    public List<Waypoint> findEscapePath(TileMap map, int startTileX, int startTileY, int maxDistance) {
        return stuckDetector.findEscapePath(map, startTileX, startTileY, maxDistance);
    }

    @Nullable
    public List<Waypoint> findEscapePath(TileMap map, int startTileX, int startTileY) {
        return stuckDetector.findEscapePath(map, startTileX, startTileY);
    }

    /**
     * @see StuckDetector#isStuck(TileMap, int, int, int)
     */
    public boolean isStuck(TileMap map, int x, int y, int stuckThreshold) {
        return stuckDetector.isStuck(map, x, y, stuckThreshold);
    }

    public boolean isStuck(TileMap map, int x, int y) {
        return stuckDetector.isStuck(map, x, y);
    }

    /**
     * @see PathSmoother#simplifyPath(List, double)
     */
    public List<Waypoint> simplifyPath(List<Waypoint> path, double tolerance) {
        return pathSmoother.simplifyPath(path, tolerance);
    }

    public List<Waypoint> simplifyPath(List<Waypoint> path) {
        return pathSmoother.simplifyPath(path);
    }

    public PathfindingConfig getConfig() {
        return config;
    }

    // ========================================================================
    // A* Implementation
    // ========================================================================

    @Nullable
    private List<TilePoint> runAStar(TileMap map, TilePoint start, TilePoint target, double wallClearance) {
        // Node arena; heap entries and predecessor links refer to nodes by index
        List<SearchNode> nodes = new ArrayList<>();
        Map<Long, Integer> nodeIndex = new HashMap<>();
        Set<Long> closedSet = new HashSet<>();
        PriorityQueue<OpenEntry> openSet = new PriorityQueue<>(OpenEntry.ORDER);

        SearchNode startNode = createNode(map, start.x(), start.y(), target);
        startNode.g = 0.0;
        startNode.f = startNode.h;
        nodes.add(startNode);
        nodeIndex.put(nodeKey(start.x(), start.y()), 0);

        long sequence = 0;
        openSet.add(new OpenEntry(0, startNode.f, startNode.h, 0.0, sequence++));

        int expansions = 0;
        int maxExpansions = config.getMaxExpansions();

        while (!openSet.isEmpty()) {
            OpenEntry entry = openSet.poll();
            SearchNode current = nodes.get(entry.nodeIndex);
            long currentKey = nodeKey(current.x, current.y);

            // Stale entry: superseded by a cheaper route or already expanded
            if (entry.g > current.g || closedSet.contains(currentKey)) {
                continue;
            }

            if (expansions >= maxExpansions) {
                log.warn("PathFinder: expansion limit {} reached searching {} -> {}", maxExpansions, start, target);
                return null;
            }
            expansions++;

            if (current.x == target.x() && current.y == target.y()) {
                log.trace("PathFinder: reached {} after {} expansions", target, expansions);
                return reconstructPath(nodes, entry.nodeIndex);
            }

            closedSet.add(currentKey);

            for (int[] direction : Directions.ALL) {
                int dx = direction[0];
                int dy = direction[1];
                int nx = current.x + dx;
                int ny = current.y + dy;

                long neighborKey = nodeKey(nx, ny);
                if (closedSet.contains(neighborKey)) {
                    continue;
                }
                if (!canMove(map, current.x, current.y, dx, dy)) {
                    continue;
                }

                Integer index = nodeIndex.get(neighborKey);
                SearchNode neighbor;
                if (index == null) {
                    neighbor = createNode(map, nx, ny, target);
                    index = nodes.size();
                    nodes.add(neighbor);
                    nodeIndex.put(neighborKey, index);
                } else {
                    neighbor = nodes.get(index);
                }

                double moveCost = Directions.isDiagonal(direction) ? DIAGONAL_COST : 1.0;
                double clearance = (current.doorway || neighbor.doorway)
                        ? config.getDoorwayClearance()
                        : wallClearance;
                double tentativeG = current.g + moveCost + neighbor.wallPenalty * clearance;

                if (tentativeG < neighbor.g) {
                    neighbor.parentIndex = entry.nodeIndex;
                    neighbor.g = tentativeG;
                    neighbor.f = tentativeG + neighbor.h;
                    openSet.add(new OpenEntry(index, neighbor.f, neighbor.h, tentativeG, sequence++));
                }
            }
        }

        log.debug("PathFinder: no path from {} to {} after {} expansions", start, target, expansions);
        return null;
    }

    /**
     * Check if a single step from (x, y) in direction (dx, dy) is allowed.
     * Diagonal steps need both orthogonal tiles they pass between to be walkable.
     */
    private boolean canMove(TileMap map, int x, int y, int dx, int dy) {
        if (!map.isWalkable(x + dx, y + dy)) {
            return false;
        }
        if (dx != 0 && dy != 0) {
            return map.isWalkable(x + dx, y) && map.isWalkable(x, y + dy);
        }
        return true;
    }

    private SearchNode createNode(TileMap map, int x, int y, TilePoint target) {
        SearchNode node = new SearchNode(x, y);
        node.h = heuristic(x, y, target.x(), target.y());
        node.wallPenalty = costModel.wallPenalty(map, x, y);
        node.doorway = costModel.isDoorway(map, x, y);
        return node;
    }

    private List<TilePoint> reconstructPath(List<SearchNode> nodes, int goalIndex) {
        List<TilePoint> path = new ArrayList<>();
        int index = goalIndex;
        while (index >= 0) {
            SearchNode node = nodes.get(index);
            path.add(new TilePoint(node.x, node.y));
            index = node.parentIndex;
        }
        Collections.reverse(path);
        return path;
    }

    @Nullable
    private static TilePoint firstWalkableNeighbour(TileMap map, TilePoint tile) {
        for (int dx = -1; dx <= 1; dx++) {
            for (int dy = -1; dy <= 1; dy++) {
                if (dx == 0 && dy == 0) {
                    continue;
                }
                TilePoint neighbour = tile.translate(dx, dy);
                if (neighbour.isWalkable(map)) {
                    return neighbour;
                }
            }
        }
        return null;
    }

    /**
     * Euclidean distance in tiles.
     */
    private static double heuristic(int x1, int y1, int x2, int y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }

    private static long nodeKey(int x, int y) {
        return ((long) x << 32) | (y & 0xFFFFFFFFL);
    }

    // ========================================================================
    // Inner Classes
    // ========================================================================

    /**
     * A* search node, one per visited tile. Lives for a single search.
     */
    private static class SearchNode {
        final int x;
        final int y;
        int parentIndex = -1;
        double g = Double.POSITIVE_INFINITY;
        double h;
        double f = Double.POSITIVE_INFINITY;
        double wallPenalty;
        boolean doorway;

        SearchNode(int x, int y) {
            this.x = x;
            this.y = y;
        }
    }

    /**
     * Open set entry. A node may have several entries; only the one matching its
     * current g is live.
     */
    private static final class OpenEntry {
        static final Comparator<OpenEntry> ORDER = Comparator
                .comparingDouble((OpenEntry e) -> e.f)
                .thenComparingDouble(e -> e.h)
                .thenComparingLong(e -> e.sequence);

        final int nodeIndex;
        final double f;
        final double h;
        final double g;
        final long sequence;

        OpenEntry(int nodeIndex, double f, double h, double g, long sequence) {
            this.nodeIndex = nodeIndex;
            this.f = f;
            this.h = h;
            this.g = g;
            this.sequence = sequence;
        }
    }
}
