package com.delver.navigation;

/**
 * Where an agent should head this frame.
 *
 * @param heading      point the agent is moving toward (next waypoint or the target)
 * @param directionX   unit vector x, 0 when already there
 * @param directionY   unit vector y, 0 when already there
 * @param followingPath true when the heading comes from a planned path, false for the
 *                      direct-vector fallback
 */
public record SteeringDecision(Waypoint heading, double directionX, double directionY, boolean followingPath) {

    /**
     * Steering from a position toward a heading.
     */
    public static SteeringDecision toward(Waypoint position, Waypoint heading, boolean followingPath) {
        double dx = heading.x() - position.x();
        double dy = heading.y() - position.y();
        double length = Math.hypot(dx, dy);
        if (length == 0.0) {
            return new SteeringDecision(heading, 0.0, 0.0, followingPath);
        }
        return new SteeringDecision(heading, dx / length, dy / length, followingPath);
    }

    /**
     * @return true if the agent is standing on its heading
     */
    public boolean isArrived() {
        return directionX == 0.0 && directionY == 0.0;
    }
}
