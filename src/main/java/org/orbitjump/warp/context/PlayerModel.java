package org.orbitjump.warp.context;

import java.util.List;

/**
 * Read-only view of the local player used for pricing and emergency detection.
 */
public interface PlayerModel {

    /** Maximum health value. */
    double MAX_HEALTH = 100.0d;

    /**
     * World x coordinate.
     */
    double x();

    /**
     * World y coordinate.
     */
    double y();

    /**
     * Health in {@code [0, 100]}.
     */
    double health();

    /**
     * Hazards currently near the player; empty when safe.
     */
    List<Danger> nearbyDangers();

    /**
     * Current position as a value.
     */
    default Position position() {
        return new Position(x(), y());
    }
}
