package org.orbitjump.warp.context;

import org.orbitjump.core.id.DestinationId;

/**
 * Warp waypoint (a planet in the shipped game).
 *
 * @param id stable identity; derived from coordinates when {@code null} is passed.
 * @param x world x coordinate of the center.
 * @param y world y coordinate of the center.
 * @param radius body radius, {@code >= 0}.
 * @param discovered whether the player has discovered this waypoint.
 */
public record Destination(DestinationId id, double x, double y, double radius, boolean discovered) {

    /**
     * Validates geometry and fills in a coordinate-derived id when absent.
     */
    public Destination {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("destination coordinates must be finite");
        }
        if (!Double.isFinite(radius) || radius < 0.0d) {
            throw new IllegalArgumentException("radius must be finite and >= 0, got " + radius);
        }
        if (id == null) {
            id = DestinationId.fromCoordinates(x, y);
        }
    }

    /**
     * Creates a discovered destination with an explicit id.
     */
    public static Destination discovered(String id, double x, double y, double radius) {
        return new Destination(DestinationId.of(id), x, y, radius, true);
    }

    /**
     * Creates an undiscovered destination with an explicit id.
     */
    public static Destination undiscovered(String id, double x, double y, double radius) {
        return new Destination(DestinationId.of(id), x, y, radius, false);
    }

    /**
     * Center position as a value.
     */
    public Position position() {
        return new Position(x, y);
    }
}
