package org.orbitjump.warp.memory;

/**
 * Evaluated emergency signals for one context.
 *
 * @param criticalHealth health below the critical threshold.
 * @param lowHealth health below the low threshold (includes critical).
 * @param rapidRepeat previous warp inside the panic window.
 * @param dangerNearby at least one hazard near the player.
 * @param score combined score in {@code [0, 1]}.
 */
public record EmergencySignals(
        boolean criticalHealth,
        boolean lowHealth,
        boolean rapidRepeat,
        boolean dangerNearby,
        double score
) {
    /** Scores above this mark a warp as an emergency. */
    public static final double EMERGENCY_THRESHOLD = 0.5d;

    /** No signal at all. */
    public static final EmergencySignals NONE = new EmergencySignals(false, false, false, false, 0.0d);

    /**
     * Returns whether the score crosses the emergency threshold.
     */
    public boolean isEmergency() {
        return score > EMERGENCY_THRESHOLD;
    }
}
