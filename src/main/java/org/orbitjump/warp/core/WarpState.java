package org.orbitjump.warp.core;

/**
 * Warp lifecycle states.
 */
public enum WarpState {
    /** Drive ready, nothing selected. */
    IDLE,
    /** Player is picking a destination. */
    SELECTING,
    /** Energy paid, animation running. */
    WARPING,
    /** Arrival frame; returns to idle on the next tick. */
    ARRIVED
}
