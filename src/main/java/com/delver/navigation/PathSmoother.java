package com.delver.navigation;

import com.delver.config.PathfindingConfig;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reduces raw tile-by-tile paths to a few turn points.
 *
 * <p>Two independent passes:
 * <ul>
 *   <li>{@link #optimizePath}: line-of-sight pruning re-validated against the map, so
 *       shortcuts keep their wall clearance</li>
 *   <li>{@link #simplifyPath}: map-free distance reduction for paths whose clearance
 *       is already trusted</li>
 * </ul>
 * They are not chained; callers pick one.
 *
 * <p>Both keep the first and last waypoint and return their input unchanged when run
 * on their own output.
 */
@Slf4j
@Singleton
public class PathSmoother {

    private final TileCostModel costModel;
    private final PathfindingConfig config;

    public PathSmoother() {
        this(new TileCostModel());
    }

    @Inject
    public PathSmoother(TileCostModel costModel) {
        this.costModel = costModel;
        this.config = costModel.getConfig();
    }

    // ========================================================================
    // Wall-aware Pruning
    // ========================================================================

    /**
     * Greedy furthest-visible pruning.
     *
     * <p>From the current anchor, jumps to the furthest later waypoint whose
     * connecting segment is clear (see {@link #isSegmentClear}); if none is, steps to
     * the next waypoint. Quadratic in the raw path length.
     *
     * @param map           the tile map
     * @param path          raw path
     * @param wallClearance required clearance in tiles away from doorways
     * @return pruned path (empty for a null path)
     */
    public List<Waypoint> optimizePath(TileMap map, List<Waypoint> path, double wallClearance) {
        if (path == null || path.isEmpty()) {
            return Collections.emptyList();
        }
        if (path.size() <= 2) {
            return List.copyOf(path);
        }

        List<Waypoint> optimized = new ArrayList<>();
        optimized.add(path.get(0));

        int anchor = 0;
        int last = path.size() - 1;
        while (anchor < last) {
            int next = anchor + 1;
            for (int candidate = last; candidate > anchor + 1; candidate--) {
                if (isSegmentClear(map, path.get(anchor), path.get(candidate), wallClearance)) {
                    next = candidate;
                    break;
                }
            }
            optimized.add(path.get(next));
            anchor = next;
        }

        log.trace("Optimized path from {} to {} waypoints", path.size(), optimized.size());
        return Collections.unmodifiableList(optimized);
    }

    /**
     * Check that a straight segment keeps its clearance.
     *
     * <p>The segment is sampled every half tile, ends included. Each sample's tile must
     * be walkable, and no blocked tile of its 3x3 neighbourhood may lie closer than the
     * effective clearance (the doorway clearance when the sample is in a doorway).
     *
     * @param map           the tile map
     * @param from          segment start in pixels
     * @param to            segment end in pixels
     * @param wallClearance clearance in tiles
     * @return true if every sample passes
     */
    public boolean isSegmentClear(TileMap map, Waypoint from, Waypoint to, double wallClearance) {
        int tileSize = config.getTileSize();
        double step = tileSize / 2.0;
        double length = from.distanceTo(to);
        int samples = Math.max(1, (int) Math.ceil(length / step));

        for (int i = 0; i <= samples; i++) {
            double t = (double) i / samples;
            double px = from.x() + (to.x() - from.x()) * t;
            double py = from.y() + (to.y() - from.y()) * t;
            TilePoint tile = TilePoint.fromPixel(px, py, tileSize);
            if (!hasClearance(map, tile.x(), tile.y(), wallClearance)) {
                return false;
            }
        }
        return true;
    }

    private boolean hasClearance(TileMap map, int x, int y, double wallClearance) {
        if (!map.isWalkable(x, y)) {
            return false;
        }
        double clearance = costModel.isDoorway(map, x, y) ? config.getDoorwayClearance() : wallClearance;
        for (int[] d : Directions.ALL) {
            if (map.isWalkable(x + d[0], y + d[1])) {
                continue;
            }
            double distance = Directions.isDiagonal(d) ? Math.sqrt(2.0) : 1.0;
            if (distance < clearance) {
                return false;
            }
        }
        return true;
    }

    // ========================================================================
    // Map-free Simplification
    // ========================================================================

    /**
     * Simplify with the configured tolerance.
     *
     * @see #simplifyPath(List, double)
     */
    public List<Waypoint> simplifyPath(List<Waypoint> path) {
        return simplifyPath(path, config.getSimplifyTolerance());
    }

    /**
     * Distance-threshold reduction.
     *
     * <p>From each anchor, the kept point starts at the next waypoint and moves to a
     * later waypoint whenever that one is more than {@code tolerance} pixels further
     * from the anchor. The kept point becomes the next anchor. No map queries.
     *
     * @param path      path to simplify
     * @param tolerance pixels a later point must gain to replace the current pick
     * @return simplified path; paths of two points or fewer are returned as given
     */
    public List<Waypoint> simplifyPath(List<Waypoint> path, double tolerance) {
        if (path == null || path.size() <= 2) {
            return path == null ? Collections.emptyList() : path;
        }

        List<Waypoint> simplified = new ArrayList<>();
        simplified.add(path.get(0));

        int anchor = 0;
        int last = path.size() - 1;
        while (anchor < last) {
            Waypoint origin = path.get(anchor);
            int furthest = anchor + 1;
            for (int i = anchor + 2; i <= last; i++) {
                if (origin.distanceTo(path.get(i)) > origin.distanceTo(path.get(furthest)) + tolerance) {
                    furthest = i;
                }
            }
            simplified.add(path.get(furthest));
            anchor = furthest;
        }

        return Collections.unmodifiableList(simplified);
    }
}
