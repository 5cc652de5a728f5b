package com.delver.navigation;

import com.delver.config.PathfindingConfig;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.List;

/**
 * Detects tiles where a monster is likely to get wedged and routes it out.
 *
 * <p>A tile is stuck when it has too many blocked neighbours, or when it sits in a
 * corner (two orthogonal neighbours in the same quadrant blocked). The escape router
 * searches outward in Manhattan rings for a better tile and returns a two-waypoint
 * path to it.
 */
@Slf4j
@Singleton
public class StuckDetector {

    private final TileCostModel costModel;
    private final PathfindingConfig config;

    public StuckDetector() {
        this(new TileCostModel());
    }

    @Inject
    public StuckDetector(TileCostModel costModel) {
        this.costModel = costModel;
        this.config = costModel.getConfig();
    }

    /**
     * Stuck check with the configured threshold.
     *
     * @see #isStuck(TileMap, int, int, int)
     */
    public boolean isStuck(TileMap map, int x, int y) {
        return isStuck(map, x, y, config.getStuckThreshold());
    }

    /**
     * Check if a tile is stuck.
     *
     * @param map       the tile map
     * @param x         tile x
     * @param y         tile y
     * @param threshold blocked neighbours (of 8) that make the tile stuck
     * @return true if at least {@code threshold} neighbours are blocked, or the tile
     *         is a corner
     */
    public boolean isStuck(TileMap map, int x, int y, int threshold) {
        if (costModel.countBlockedNeighbours(map, x, y) >= threshold) {
            return true;
        }
        return isCorner(map, x, y);
    }

    /**
     * Check if both orthogonal neighbours of some quadrant are blocked. Catches
     * pockets that stay under the blocked-neighbour threshold.
     */
    public boolean isCorner(TileMap map, int x, int y) {
        for (int[][] corner : Directions.CORNERS) {
            int[] a = corner[0];
            int[] b = corner[1];
            if (!map.isWalkable(x + a[0], y + a[1]) && !map.isWalkable(x + b[0], y + b[1])) {
                return true;
            }
        }
        return false;
    }

    /**
     * Escape path with the configured search distance.
     *
     * @see #findEscapePath(TileMap, int, int, int)
     */
    @Nullable
    public List<Waypoint> findEscapePath(TileMap map, int tileX, int tileY) {
        return findEscapePath(map, tileX, tileY, config.getEscapeMaxDistance());
    }

    /**
     * Find a short corrective path away from a stuck tile.
     *
     * <p>Walkable tiles on rings {@code |dx| + |dy| == r}, r = 1..maxDistance, are
     * scored {@code r + wallWeight * walls - openWeight * walkables} over their 8
     * neighbours. Selection order:
     * <ol>
     *   <li>the nearest open-space candidate (enough walkable neighbours, not stuck)</li>
     *   <li>the best-scored candidate that is not stuck</li>
     *   <li>the first walkable, non-stuck immediate neighbour</li>
     * </ol>
     *
     * @param map         the tile map
     * @param tileX       current tile x
     * @param tileY       current tile y
     * @param maxDistance largest ring radius searched
     * @return two waypoints (current tile centre, escape tile centre), or null if not
     *         even a neighbouring tile qualifies
     */
    @Nullable
    public List<Waypoint> findEscapePath(TileMap map, int tileX, int tileY, int maxDistance) {
        if (map == null) {
            log.warn("StuckDetector: null map");
            return null;
        }

        TilePoint origin = new TilePoint(tileX, tileY);
        TilePoint best = null;
        double bestScore = Double.POSITIVE_INFINITY;
        List<TilePoint> openSpaces = new ArrayList<>();

        for (int radius = 1; radius <= maxDistance; radius++) {
            for (TilePoint candidate : ring(origin, radius)) {
                if (!candidate.isWalkable(map)) {
                    continue;
                }

                int walls = costModel.countBlockedNeighbours(map, candidate.x(), candidate.y());
                int walkables = 8 - walls;
                if (isStuck(map, candidate.x(), candidate.y())) {
                    continue;
                }

                double score = radius
                        + config.getEscapeWallWeight() * walls
                        - config.getEscapeOpenWeight() * walkables;
                if (score < bestScore) {
                    bestScore = score;
                    best = candidate;
                }
                if (walkables >= config.getOpenSpaceNeighbours()) {
                    openSpaces.add(candidate);
                }
            }
        }

        TilePoint chosen = nearest(origin, openSpaces);
        if (chosen != null) {
            log.debug("Escape from {} to open space {}", origin, chosen);
        } else if (best != null) {
            chosen = best;
            log.debug("Escape from {} to best candidate {} (score {})", origin, chosen, bestScore);
        } else {
            chosen = emergencyStep(map, origin);
            if (chosen == null) {
                log.debug("No escape from {}: sealed in", origin);
                return null;
            }
            log.debug("Emergency escape step from {} to {}", origin, chosen);
        }

        int tileSize = config.getTileSize();
        return List.of(Waypoint.tileCenter(origin, tileSize), Waypoint.tileCenter(chosen, tileSize));
    }

    @Nullable
    private TilePoint emergencyStep(TileMap map, TilePoint origin) {
        for (int[] d : Directions.ALL) {
            TilePoint neighbour = origin.translate(d[0], d[1]);
            if (neighbour.isWalkable(map) && !isStuck(map, neighbour.x(), neighbour.y())) {
                return neighbour;
            }
        }
        return null;
    }

    @Nullable
    private static TilePoint nearest(TilePoint origin, List<TilePoint> candidates) {
        TilePoint nearest = null;
        int nearestDistance = Integer.MAX_VALUE;
        for (TilePoint candidate : candidates) {
            int distance = origin.manhattanDistance(candidate);
            if (distance < nearestDistance) {
                nearestDistance = distance;
                nearest = candidate;
            }
        }
        return nearest;
    }

    /**
     * Tiles at exactly Manhattan distance {@code radius} from the centre.
     */
    private static List<TilePoint> ring(TilePoint center, int radius) {
        List<TilePoint> tiles = new ArrayList<>(4 * radius);
        for (int dx = -radius; dx <= radius; dx++) {
            int dy = radius - Math.abs(dx);
            tiles.add(center.translate(dx, dy));
            if (dy != 0) {
                tiles.add(center.translate(dx, -dy));
            }
        }
        return tiles;
    }
}
