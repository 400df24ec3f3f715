package org.orbitjump.warp.core;

import lombok.Builder;
import lombok.Value;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.energy.EnergyStatus;

/**
 * Read-only warp drive view for HUD collaborators.
 */
@Value
@Builder
public class WarpStatus {
    WarpState state;
    boolean unlocked;
    EnergyStatus energy;
    /** Target of the in-flight warp, or {@code null}. */
    Destination target;
    /** Progress of the in-flight warp in {@code [0, 1]}; {@code 0} when idle. */
    double progress;
    /** Highlighted selection, or {@code null}. */
    Destination selected;
}
