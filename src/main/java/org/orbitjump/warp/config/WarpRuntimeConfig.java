package org.orbitjump.warp.config;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime configuration bound once when the warp subsystem is composed.
 *
 * <p>Every tunable of the energy pool, the learned memory, the cost floor and the warp
 * lifecycle lives here. Defaults reproduce the shipped game balance.</p>
 */
@Value
@Builder(toBuilder = true)
public class WarpRuntimeConfig {

    public static final String REASON_ENERGY_INVALID = "W_CFG_ENERGY_INVALID";
    public static final String REASON_COST_INVALID = "W_CFG_COST_INVALID";
    public static final String REASON_WARP_TIMING_INVALID = "W_CFG_WARP_TIMING_INVALID";
    public static final String REASON_GEOMETRY_INVALID = "W_CFG_GEOMETRY_INVALID";
    public static final String REASON_MEMORY_POLICY_INVALID = "W_CFG_MEMORY_POLICY_INVALID";

    /** Energy capacity before any capacity upgrade. */
    @Builder.Default
    double maxEnergy = 1000.0d;

    /** Energy regained per second before any regeneration upgrade. */
    @Builder.Default
    double regenPerSecond = 50.0d;

    /** Cheapest possible static warp price. */
    @Builder.Default
    int minimumCost = 50;

    /** World units of distance per one unit of static cost. */
    @Builder.Default
    double distancePerCostUnit = 100.0d;

    /** Lower bound of any learned quote, as a fraction of the static cost. */
    @Builder.Default
    double costFloorRatio = 0.25d;

    /** Fixed length of the warp animation. */
    @Builder.Default
    double warpDurationSeconds = 2.0d;

    /** Grid pitch used to quantize route sources into cells. */
    @Builder.Default
    double routeCellSize = 100.0d;

    /** Pick radius of destination selection. */
    @Builder.Default
    double selectionRadius = 50.0d;

    /** Gap between a destination's surface and the arrival point. */
    @Builder.Default
    double arrivalStandoff = 30.0d;

    /** Number of completed warps between two memory consolidations. */
    @Builder.Default
    int consolidationInterval = 10;

    /** Routes with fewer uses than this are evicted on consolidation. */
    @Builder.Default
    int routeEvictionThreshold = 3;

    /** Ring-buffer capacity of the learning curve. */
    @Builder.Default
    int learningCurveCapacity = 50;

    /** Learning-curve samples kept by consolidation. */
    @Builder.Default
    int consolidatedCurveLength = 30;

    /** Number of recent samples inspected for the adaptation trend. */
    @Builder.Default
    int adaptationWindow = 10;

    /** Two warps closer than this are counted as a chain. */
    @Builder.Default
    double chainWindowSeconds = 10.0d;

    /** Two warps closer than this are treated as a panic signal. */
    @Builder.Default
    double panicWindowSeconds = 5.0d;

    /** Warps costing at most this much count as optimal route choices. */
    @Builder.Default
    double optimalCostThreshold = 100.0d;

    /** Capacity of the failed-attempt debug log. */
    @Builder.Default
    int failedAttemptLogCapacity = 20;

    /** Whether the drive is usable without the unlock upgrade. */
    @Builder.Default
    boolean startUnlocked = false;

    /**
     * Returns the shipped game balance.
     */
    public static WarpRuntimeConfig defaults() {
        return WarpRuntimeConfig.builder().build();
    }

    /**
     * Validates cross-field consistency.
     *
     * @return this config, for chaining.
     * @throws WarpConfigurationException when any value is out of its domain.
     */
    public WarpRuntimeConfig validate() {
        requirePositive(maxEnergy, "maxEnergy", REASON_ENERGY_INVALID);
        requireNonNegative(regenPerSecond, "regenPerSecond", REASON_ENERGY_INVALID);

        requireAtLeast(minimumCost, 0, "minimumCost", REASON_COST_INVALID);
        requirePositive(distancePerCostUnit, "distancePerCostUnit", REASON_COST_INVALID);
        if (!Double.isFinite(costFloorRatio) || costFloorRatio < 0.0d || costFloorRatio > 1.0d) {
            throw new WarpConfigurationException(REASON_COST_INVALID, "costFloorRatio", "within [0.0, 1.0]", costFloorRatio);
        }

        requirePositive(warpDurationSeconds, "warpDurationSeconds", REASON_WARP_TIMING_INVALID);
        requireNonNegative(chainWindowSeconds, "chainWindowSeconds", REASON_WARP_TIMING_INVALID);
        requireNonNegative(panicWindowSeconds, "panicWindowSeconds", REASON_WARP_TIMING_INVALID);

        requirePositive(routeCellSize, "routeCellSize", REASON_GEOMETRY_INVALID);
        requireNonNegative(selectionRadius, "selectionRadius", REASON_GEOMETRY_INVALID);
        requireNonNegative(arrivalStandoff, "arrivalStandoff", REASON_GEOMETRY_INVALID);

        requireAtLeast(consolidationInterval, 1, "consolidationInterval", REASON_MEMORY_POLICY_INVALID);
        requireAtLeast(routeEvictionThreshold, 0, "routeEvictionThreshold", REASON_MEMORY_POLICY_INVALID);
        requireAtLeast(learningCurveCapacity, 1, "learningCurveCapacity", REASON_MEMORY_POLICY_INVALID);
        if (consolidatedCurveLength <= 0 || consolidatedCurveLength > learningCurveCapacity) {
            throw new WarpConfigurationException(
                    REASON_MEMORY_POLICY_INVALID,
                    "consolidatedCurveLength",
                    "within [1, learningCurveCapacity]",
                    consolidatedCurveLength
            );
        }
        if (adaptationWindow < 2 || adaptationWindow > learningCurveCapacity) {
            throw new WarpConfigurationException(
                    REASON_MEMORY_POLICY_INVALID,
                    "adaptationWindow",
                    "within [2, learningCurveCapacity]",
                    adaptationWindow
            );
        }
        requireAtLeast(failedAttemptLogCapacity, 1, "failedAttemptLogCapacity", REASON_MEMORY_POLICY_INVALID);
        requireNonNegative(optimalCostThreshold, "optimalCostThreshold", REASON_MEMORY_POLICY_INVALID);
        return this;
    }

    private static void requireAtLeast(int value, int minimum, String name, String reasonCode) {
        if (value < minimum) {
            throw new WarpConfigurationException(reasonCode, name, ">= " + minimum, value);
        }
    }

    private static void requirePositive(double value, String name, String reasonCode) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new WarpConfigurationException(reasonCode, name, "finite and > 0", value);
        }
    }

    private static void requireNonNegative(double value, String name, String reasonCode) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new WarpConfigurationException(reasonCode, name, "finite and >= 0", value);
        }
    }
}
