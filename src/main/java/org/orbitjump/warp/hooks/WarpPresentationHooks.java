package org.orbitjump.warp.hooks;

import org.orbitjump.warp.core.WarpFailureReason;

/**
 * Fire-and-forget presentation callbacks (audio, particles, camera, achievements).
 *
 * <p>Subscribers override only what they need. A subscriber that throws is logged and skipped;
 * it never affects the warp itself.</p>
 */
public interface WarpPresentationHooks {

    /**
     * The drive became usable.
     */
    default void onWarpDriveUnlocked() {
    }

    /**
     * Energy was paid and the warp animation starts.
     */
    default void onWarpCommitted(WarpCommitted event) {
    }

    /**
     * The player arrived at the destination.
     */
    default void onWarpArrived(WarpArrived event) {
    }

    /**
     * A commit was rejected.
     */
    default void onWarpFailed(WarpFailureReason reason) {
    }
}
