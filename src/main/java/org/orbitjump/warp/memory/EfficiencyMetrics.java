package org.orbitjump.warp.memory;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * How well the player plans warps.
 */
@Getter
@Accessors(fluent = true)
public final class EfficiencyMetrics {
    /** Energy paid above the optimal-cost threshold, summed over all warps. */
    private double wastedEnergy;
    /** Number of warps judged cost-efficient. */
    private int optimalRoutes;
    /** Bounded history of recent warp prices. */
    private final LearningCurve learningCurve;
    /** Cost-improvement trend in {@code [0, 1]}. */
    private double adaptationLevel;

    EfficiencyMetrics(int learningCurveCapacity) {
        this.learningCurve = new LearningCurve(learningCurveCapacity);
    }

    void restore(double wastedEnergy, int optimalRoutes, double adaptationLevel) {
        this.wastedEnergy = wastedEnergy;
        this.optimalRoutes = optimalRoutes;
        this.adaptationLevel = adaptationLevel;
    }

    void countOptimal() {
        optimalRoutes++;
    }

    void addWaste(double amount) {
        wastedEnergy += amount;
    }

    void updateAdaptationLevel(double adaptationLevel) {
        this.adaptationLevel = adaptationLevel;
    }
}
