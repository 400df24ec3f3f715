package org.orbitjump.warp.memory;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable summary of the learned memory for HUD and debug overlays.
 */
@Value
@Builder
public class MemoryStats {
    /** Completed warps. */
    int totalWarps;
    /** Routes currently remembered. */
    int knownRoutes;
    /** Share of warps judged cost-efficient. */
    double efficiency;
    /** Derived skill in {@code [0, 1]}. */
    double skillLevel;
    /** Cost-improvement trend in {@code [0, 1]}. */
    double adaptationLevel;
    /** Destinations visited at least once. */
    int knownDestinations;
    /** Share of warps flagged as emergencies. */
    double emergencyRate;
    /** Rejected warp attempts since the session started. */
    long failedAttempts;
}
