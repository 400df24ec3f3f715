package org.orbitjump.warp.context;

/**
 * World-space point.
 *
 * @param x world x coordinate.
 * @param y world y coordinate.
 */
public record Position(double x, double y) {

    /**
     * Euclidean distance to {@code other}.
     */
    public double distanceTo(Position other) {
        return distance(x, y, other.x, other.y);
    }

    /**
     * Euclidean distance between two points.
     */
    public static double distance(double x1, double y1, double x2, double y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }
}
