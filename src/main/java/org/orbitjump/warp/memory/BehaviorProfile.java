package org.orbitjump.warp.memory;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Process-wide travel behavior counters.
 *
 * <p>{@code skillLevel} is derived from the other counters by {@link WarpMemory} and has no
 * independent setter.</p>
 */
@Getter
@Accessors(fluent = true)
public final class BehaviorProfile {
    private int totalWarps;
    private int emergencyWarps;
    private int explorationWarps;
    private int returnWarps;
    private int warpChains;
    private double lastWarpTime;
    private double averageWarpDistance;
    private double skillLevel;

    BehaviorProfile() {
    }

    void restore(
            int totalWarps,
            int emergencyWarps,
            int explorationWarps,
            int returnWarps,
            int warpChains,
            double lastWarpTime,
            double averageWarpDistance
    ) {
        this.totalWarps = totalWarps;
        this.emergencyWarps = emergencyWarps;
        this.explorationWarps = explorationWarps;
        this.returnWarps = returnWarps;
        this.warpChains = warpChains;
        this.lastWarpTime = lastWarpTime;
        this.averageWarpDistance = averageWarpDistance;
    }

    void countWarp(double distance) {
        totalWarps++;
        averageWarpDistance += (distance - averageWarpDistance) / totalWarps;
    }

    void countEmergency() {
        emergencyWarps++;
    }

    void countExploration() {
        explorationWarps++;
    }

    void countReturn() {
        returnWarps++;
    }

    void countChain() {
        warpChains++;
    }

    void stampWarpTime(double now) {
        lastWarpTime = now;
    }

    void updateSkillLevel(double skillLevel) {
        this.skillLevel = skillLevel;
    }

    /**
     * Share of warps flagged as emergencies; {@code 0} with no warps.
     */
    public double emergencyRatio() {
        return totalWarps == 0 ? 0.0d : (double) emergencyWarps / totalWarps;
    }

    /**
     * Share of warps to never-visited destinations; {@code 0} with no warps.
     */
    public double explorationRatio() {
        return totalWarps == 0 ? 0.0d : (double) explorationWarps / totalWarps;
    }
}
