package org.orbitjump.warp.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.orbitjump.core.id.DestinationId;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.Position;
import org.orbitjump.warp.context.WarpContext;
import org.orbitjump.warp.energy.EnergyPool;
import org.orbitjump.warp.memory.WarpMemory;

import java.util.Objects;

/**
 * Adaptive warp price composition.
 * <p>
 * Canonical quote:
 * </p>
 * <pre>
 * base      = energy.baseCost(distance)
 * adjusted  = base * familiarity * mastery * emergency * exploration * affinity
 * quote     = floor(max(adjusted, floorRatio * base))
 * </pre>
 * <p>
 * When the source, destination or context is unknown the engine answers the static
 * {@code base} cost. No factor exceeds {@code 1.0}, so a quote never exceeds its static cost.
 * The engine only reads memory and energy.
 * </p>
 */
@Accessors(fluent = true)
public final class WarpCostEngine {

    private static final double EMERGENCY_CEILING = 0.7d;
    private static final double EMERGENCY_SLOPE = 0.3d;
    private static final double EMERGENCY_FLOOR = 0.4d;
    private static final double EMERGENCY_THRESHOLD = 0.5d;

    private final EnergyPool energy;
    private final WarpMemory memory;
    @Getter
    private final double costFloorRatio;

    /**
     * Creates an engine reading the given energy pool and memory.
     *
     * @param costFloorRatio lower bound of a learned quote as a fraction of its static cost.
     */
    public WarpCostEngine(EnergyPool energy, WarpMemory memory, double costFloorRatio) {
        this.energy = Objects.requireNonNull(energy, "energy");
        this.memory = Objects.requireNonNull(memory, "memory");
        if (!Double.isFinite(costFloorRatio) || costFloorRatio < 0.0d || costFloorRatio > 1.0d) {
            throw new IllegalArgumentException("costFloorRatio must be within [0.0, 1.0], got " + costFloorRatio);
        }
        this.costFloorRatio = costFloorRatio;
    }

    /**
     * Quotes a warp of {@code distance} from {@code source} to {@code destination}.
     *
     * @param distance travel distance; {@code >= 0} and not NaN.
     * @param source warp start, or {@code null} for a static quote.
     * @param destination warp target, or {@code null} for a static quote.
     * @param context player situation, or {@code null} for a static quote.
     * @return price in integer energy units.
     */
    public int quote(double distance, Position source, Destination destination, WarpContext context) {
        return computeInternal(distance, source, destination, context, null);
    }

    /**
     * Quotes a warp from {@code source} straight to {@code destination}.
     */
    public int quote(Position source, Destination destination, WarpContext context) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        return quote(source.distanceTo(destination.position()), source, destination, context);
    }

    /**
     * Static, memory-free price of {@code distance}.
     */
    public int staticQuote(double distance) {
        return energy.baseCost(distance);
    }

    /**
     * Explainable quote. Intended for HUD tooltips and debugging.
     */
    public QuoteBreakdown explain(double distance, Position source, Destination destination, WarpContext context) {
        MutableQuoteBreakdown breakdown = new MutableQuoteBreakdown();
        computeInternal(distance, source, destination, context, breakdown);
        return breakdown.toImmutable();
    }

    /**
     * Returns whether {@code cost} can be paid from current energy.
     */
    public boolean isAffordable(int cost) {
        return energy.hasEnergy(cost);
    }

    /**
     * Emergency discount for an emergency score: {@code 1.0} at or below 0.5, otherwise
     * {@code max(0.4, 0.7 - score * 0.3)}.
     */
    public static double emergencyMultiplier(double emergencyScore) {
        if (!(emergencyScore > EMERGENCY_THRESHOLD)) {
            return 1.0d;
        }
        return Math.max(EMERGENCY_FLOOR, EMERGENCY_CEILING - emergencyScore * EMERGENCY_SLOPE);
    }

    /**
     * Shared execution path for both scalar and explainable quotes.
     */
    private int computeInternal(
            double distance,
            Position source,
            Destination destination,
            WarpContext context,
            MutableQuoteBreakdown out
    ) {
        int base = energy.baseCost(distance);
        if (source == null || destination == null || context == null) {
            if (out != null) {
                out.distance = distance;
                out.destination = destination == null ? null : destination.id();
                out.staticFallback = true;
                out.baseCost = base;
                out.familiarity = 1.0d;
                out.mastery = 1.0d;
                out.emergencyScore = 0.0d;
                out.emergency = 1.0d;
                out.exploration = 1.0d;
                out.affinity = 1.0d;
                out.adjusted = base;
                out.floorApplied = false;
                out.cost = base;
            }
            return base;
        }

        DestinationId id = destination.id();
        double familiarity = memory.routeFamiliarityBonus(source, id);
        double mastery = memory.masteryMultiplier();
        double emergencyScore = memory.detectEmergency(context);
        double emergency = emergencyMultiplier(emergencyScore);
        double exploration = memory.explorationBonus(id);
        double affinity = memory.affinityBonus(id);

        double adjusted = (double) base * familiarity * mastery * emergency * exploration * affinity;
        double floor = base * costFloorRatio;
        boolean floorApplied = adjusted < floor;
        int cost = toCostUnits(floorApplied ? floor : adjusted);

        if (out != null) {
            out.distance = distance;
            out.destination = id;
            out.staticFallback = false;
            out.baseCost = base;
            out.familiarity = familiarity;
            out.mastery = mastery;
            out.emergencyScore = emergencyScore;
            out.emergency = emergency;
            out.exploration = exploration;
            out.affinity = affinity;
            out.adjusted = adjusted;
            out.floorApplied = floorApplied;
            out.cost = cost;
        }
        return cost;
    }

    /**
     * Floors to whole energy units; double-to-int narrowing saturates.
     */
    private static int toCostUnits(double value) {
        return (int) Math.floor(value);
    }

    /**
     * Immutable explainability payload.
     */
    public record QuoteBreakdown(
            double distance,
            DestinationId destination,
            boolean staticFallback,
            int baseCost,
            double familiarity,
            double mastery,
            double emergencyScore,
            double emergency,
            double exploration,
            double affinity,
            double adjusted,
            boolean floorApplied,
            int cost
    ) {
        /**
         * Returns the product of all learned factors.
         */
        public double combinedMultiplier() {
            return familiarity * mastery * emergency * exploration * affinity;
        }

        /**
         * Returns energy saved against the static price.
         */
        public int savings() {
            return baseCost - cost;
        }
    }

    /**
     * Mutable container filled by the explain path.
     */
    private static final class MutableQuoteBreakdown {
        private double distance;
        private DestinationId destination;
        private boolean staticFallback;
        private int baseCost;
        private double familiarity;
        private double mastery;
        private double emergencyScore;
        private double emergency;
        private double exploration;
        private double affinity;
        private double adjusted;
        private boolean floorApplied;
        private int cost;

        private QuoteBreakdown toImmutable() {
            return new QuoteBreakdown(
                    distance,
                    destination,
                    staticFallback,
                    baseCost,
                    familiarity,
                    mastery,
                    emergencyScore,
                    emergency,
                    exploration,
                    affinity,
                    adjusted,
                    floorApplied,
                    cost
            );
        }
    }
}
