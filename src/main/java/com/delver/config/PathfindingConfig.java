package com.delver.config;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for monster pathfinding.
 *
 * <p>Groups the constants used by:
 * <ul>
 *   <li>Tile geometry (pixel to tile conversion)</li>
 *   <li>Wall proximity cost shaping</li>
 *   <li>Stuck detection and escape routing</li>
 *   <li>A* search budget and path length</li>
 *   <li>Path smoothing and pursuit replanning</li>
 * </ul>
 *
 * <p>Values are validated on construction; an impossible value throws
 * {@link IllegalArgumentException}.
 */
@Value
public class PathfindingConfig {

    /**
     * Edge length of a map tile in pixels, shared with the renderer and the map.
     */
    public static final int TILE_SIZE = 32;

    /**
     * Defaults used by the game.
     */
    public static final PathfindingConfig DEFAULT = PathfindingConfig.builder()
            .tileSize(TILE_SIZE)
            .maxExpansions(500)
            .maxWaypoints(20)
            .wallClearance(1.5)
            .doorwayClearance(0.5)
            .wallPenaltyRadius(2)
            .adjacentWallPenalty(2.0)
            .doorwayWallPenalty(0.5)
            .stuckThreshold(3)
            .escapeMaxDistance(8)
            .openSpaceNeighbours(5)
            .escapeWallWeight(0.5)
            .escapeOpenWeight(0.3)
            .simplifyTolerance(1.0)
            .replanIntervalMillis(1000L)
            .arrivalRadius(TILE_SIZE / 4.0)
            .build();

    // ========================================================================
    // Geometry
    // ========================================================================

    /**
     * Tile edge length in pixels.
     */
    int tileSize;

    // ========================================================================
    // A* Search
    // ========================================================================

    /**
     * Node expansions allowed per search before it is abandoned.
     */
    int maxExpansions;

    /**
     * Default cap on waypoints returned by a search.
     */
    int maxWaypoints;

    /**
     * Default multiplier applied to the wall penalty of a tile.
     */
    double wallClearance;

    /**
     * Multiplier used instead of the wall clearance when a doorway is involved.
     */
    double doorwayClearance;

    // ========================================================================
    // Cost Model
    // ========================================================================

    /**
     * Half-width of the square scanned for the wall penalty.
     */
    int wallPenaltyRadius;

    /**
     * Flat penalty of an orthogonally adjacent wall.
     */
    double adjacentWallPenalty;

    /**
     * Flat penalty of an orthogonally adjacent wall when the tile is a doorway.
     */
    double doorwayWallPenalty;

    // ========================================================================
    // Stuck Detection / Escape
    // ========================================================================

    /**
     * Blocked neighbours (out of 8) that mark a tile as stuck.
     */
    int stuckThreshold;

    /**
     * Manhattan radius searched for an escape tile.
     */
    int escapeMaxDistance;

    /**
     * Walkable neighbours needed for an escape candidate to count as open space.
     */
    int openSpaceNeighbours;

    double escapeWallWeight;

    double escapeOpenWeight;

    // ========================================================================
    // Smoothing / Pursuit
    // ========================================================================

    /**
     * Default tolerance, in pixels, of the map-free path simplifier.
     */
    double simplifyTolerance;

    /**
     * Minimum time between two searches for the same agent.
     */
    long replanIntervalMillis;

    /**
     * Distance in pixels at which a waypoint counts as reached.
     */
    double arrivalRadius;

    @Builder(toBuilder = true)
    private PathfindingConfig(int tileSize, int maxExpansions, int maxWaypoints,
                              double wallClearance, double doorwayClearance,
                              int wallPenaltyRadius, double adjacentWallPenalty, double doorwayWallPenalty,
                              int stuckThreshold, int escapeMaxDistance, int openSpaceNeighbours,
                              double escapeWallWeight, double escapeOpenWeight,
                              double simplifyTolerance, long replanIntervalMillis, double arrivalRadius) {
        require(tileSize > 0, "tileSize must be positive: " + tileSize);
        require(maxExpansions > 0, "maxExpansions must be positive: " + maxExpansions);
        require(maxWaypoints > 0, "maxWaypoints must be positive: " + maxWaypoints);
        require(wallClearance >= 0, "wallClearance must not be negative: " + wallClearance);
        require(doorwayClearance >= 0, "doorwayClearance must not be negative: " + doorwayClearance);
        require(wallPenaltyRadius >= 1, "wallPenaltyRadius must be at least 1: " + wallPenaltyRadius);
        require(stuckThreshold >= 1 && stuckThreshold <= 8, "stuckThreshold must be in 1..8: " + stuckThreshold);
        require(escapeMaxDistance >= 1, "escapeMaxDistance must be at least 1: " + escapeMaxDistance);
        require(simplifyTolerance >= 0, "simplifyTolerance must not be negative: " + simplifyTolerance);
        require(replanIntervalMillis >= 0, "replanIntervalMillis must not be negative: " + replanIntervalMillis);
        require(arrivalRadius >= 0, "arrivalRadius must not be negative: " + arrivalRadius);

        this.tileSize = tileSize;
        this.maxExpansions = maxExpansions;
        this.maxWaypoints = maxWaypoints;
        this.wallClearance = wallClearance;
        this.doorwayClearance = doorwayClearance;
        this.wallPenaltyRadius = wallPenaltyRadius;
        this.adjacentWallPenalty = adjacentWallPenalty;
        this.doorwayWallPenalty = doorwayWallPenalty;
        this.stuckThreshold = stuckThreshold;
        this.escapeMaxDistance = escapeMaxDistance;
        this.openSpaceNeighbours = openSpaceNeighbours;
        this.escapeWallWeight = escapeWallWeight;
        this.escapeOpenWeight = escapeOpenWeight;
        this.simplifyTolerance = simplifyTolerance;
        this.replanIntervalMillis = replanIntervalMillis;
        this.arrivalRadius = arrivalRadius;
    }

    /**
     * Copy of this configuration with another tile size. The arrival radius keeps
     * its ratio to the tile.
     *
     * @param size tile edge length in pixels
     * @return adjusted configuration
     */
    public PathfindingConfig withTileSize(int size) {
        double arrivalRatio = arrivalRadius / tileSize;
        return toBuilder()
                .tileSize(size)
                .arrivalRadius(size * arrivalRatio)
                .build();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
