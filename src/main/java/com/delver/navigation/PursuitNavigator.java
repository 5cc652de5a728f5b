package com.delver.navigation;

import com.delver.config.PathfindingConfig;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Per-agent pursuit steering on top of {@link PathFinder}.
 *
 * <p>Each monster owns one instance. Searches run at most once per replan interval;
 * between searches the agent walks the last plan waypoint by waypoint. When there is
 * no usable plan (search failed, or plan used up) the agent is steered straight at the
 * target.
 *
 * <p>Not thread-safe and not shared between agents.
 */
@Slf4j
public class PursuitNavigator {

    private final PathFinder pathFinder;
    private final PathfindingConfig config;
    private final LongSupplier clock;

    private List<Waypoint> plan = Collections.emptyList();
    private int nextWaypoint;
    private long lastPlanMillis;
    private boolean planned;

    @Inject
    public PursuitNavigator(PathFinder pathFinder) {
        this(pathFinder, System::currentTimeMillis);
    }

    /**
     * @param pathFinder path source
     * @param clock      millisecond clock, injectable for game time or tests
     */
    public PursuitNavigator(PathFinder pathFinder, LongSupplier clock) {
        this.pathFinder = pathFinder;
        this.config = pathFinder.getConfig();
        this.clock = clock;
    }

    /**
     * Decide where to head this frame.
     *
     * @param map      the tile map
     * @param position agent position in pixels
     * @param target   pursued position in pixels
     * @return steering toward the next waypoint, or straight at the target
     */
    public SteeringDecision steer(TileMap map, Waypoint position, Waypoint target) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(target, "target");

        long now = clock.getAsLong();
        if (map != null && isReplanDue(now)) {
            replan(map, position, target, now);
        }

        skipReachedWaypoints(position);

        if (nextWaypoint < plan.size()) {
            return SteeringDecision.toward(position, plan.get(nextWaypoint), true);
        }
        return SteeringDecision.toward(position, target, false);
    }

    /**
     * Drop the current plan; the next {@link #steer} call searches again.
     */
    public void reset() {
        plan = Collections.emptyList();
        nextWaypoint = 0;
        planned = false;
    }

    public boolean hasPlan() {
        return nextWaypoint < plan.size();
    }

    /**
     * Waypoints not yet reached.
     */
    public List<Waypoint> getRemainingPlan() {
        return plan.subList(Math.min(nextWaypoint, plan.size()), plan.size());
    }

    private boolean isReplanDue(long now) {
        return !planned || now - lastPlanMillis >= config.getReplanIntervalMillis();
    }

    private void replan(TileMap map, Waypoint position, Waypoint target, long now) {
        List<Waypoint> path = pathFinder.findPath(map, position, target);
        planned = true;
        lastPlanMillis = now;
        nextWaypoint = 0;
        if (path == null) {
            log.debug("Pursuit: no path from {} to {}, moving directly", position, target);
            plan = Collections.emptyList();
        } else {
            plan = path;
        }
    }

    private void skipReachedWaypoints(Waypoint position) {
        double arrival = config.getArrivalRadius();
        while (nextWaypoint < plan.size() && position.distanceTo(plan.get(nextWaypoint)) <= arrival) {
            nextWaypoint++;
        }
    }
}
