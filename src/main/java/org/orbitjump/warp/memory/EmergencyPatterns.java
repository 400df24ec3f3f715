package org.orbitjump.warp.memory;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Counters of warps taken under pressure.
 */
@Getter
@Accessors(fluent = true)
public final class EmergencyPatterns {
    /** Warps taken at critical health. */
    private int lowHealthWarps;
    /** Warps taken within the panic window of the previous warp. */
    private int panicWarps;
    /** Warps taken with hazards nearby. */
    private int rescueWarps;
    /** Session time of the latest warp scored as an emergency. */
    private double lastEmergencyTime;

    EmergencyPatterns() {
    }

    void restore(int lowHealthWarps, int panicWarps, int rescueWarps, double lastEmergencyTime) {
        this.lowHealthWarps = lowHealthWarps;
        this.panicWarps = panicWarps;
        this.rescueWarps = rescueWarps;
        this.lastEmergencyTime = lastEmergencyTime;
    }

    void record(EmergencySignals signals, double now) {
        if (signals.criticalHealth()) {
            lowHealthWarps++;
        }
        if (signals.rapidRepeat()) {
            panicWarps++;
        }
        if (signals.dangerNearby()) {
            rescueWarps++;
        }
        if (signals.isEmergency()) {
            lastEmergencyTime = now;
        }
    }
}
