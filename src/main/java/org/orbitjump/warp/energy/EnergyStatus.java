package org.orbitjump.warp.energy;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable energy view for HUD collaborators.
 */
@Value
@Builder
public class EnergyStatus {
    /** Current energy. */
    double current;
    /** Current capacity. */
    double max;
    /** Fill ratio in {@code [0, 1]}. */
    double percent;
    /** Regeneration per second. */
    double regenPerSecond;
    /** True while a warp is in flight. */
    boolean regenerationSuspended;
}
