package org.orbitjump.warp.memory;

import org.orbitjump.core.id.DestinationId;

import java.util.List;
import java.util.Objects;

/**
 * Persistable image of a {@link WarpMemory}.
 *
 * <p>Failed attempts are debug data and are not part of the snapshot.</p>
 */
public record MemorySnapshot(
        List<RouteEntry> routes,
        BehaviorSnapshot behavior,
        List<AffinityEntry> affinities,
        EfficiencySnapshot efficiency,
        EmergencySnapshot emergency
) {

    /**
     * Normalizes absent sections to empty ones and copies lists defensively.
     */
    public MemorySnapshot {
        routes = routes == null ? List.of() : List.copyOf(routes);
        behavior = behavior == null ? BehaviorSnapshot.EMPTY : behavior;
        affinities = affinities == null ? List.of() : List.copyOf(affinities);
        efficiency = efficiency == null ? EfficiencySnapshot.EMPTY : efficiency;
        emergency = emergency == null ? EmergencySnapshot.EMPTY : emergency;
    }

    /**
     * Snapshot of a memory that has never learned anything.
     */
    public static MemorySnapshot empty() {
        return new MemorySnapshot(null, null, null, null, null);
    }

    /**
     * One remembered route.
     */
    public record RouteEntry(RouteKey key, int uses, double totalCostPaid) {
        public RouteEntry {
            Objects.requireNonNull(key, "key");
        }
    }

    /**
     * One visited destination. {@code affinity} is informational; it is recomputed from visits
     * on restore.
     */
    public record AffinityEntry(DestinationId destination, int visits, double lastVisitTime, double affinity) {
        public AffinityEntry {
            Objects.requireNonNull(destination, "destination");
        }
    }

    public record BehaviorSnapshot(
            int totalWarps,
            int emergencyWarps,
            int explorationWarps,
            int returnWarps,
            int warpChains,
            double lastWarpTime,
            double averageWarpDistance,
            double skillLevel
    ) {
        public static final BehaviorSnapshot EMPTY = new BehaviorSnapshot(0, 0, 0, 0, 0, 0.0d, 0.0d, 0.0d);
    }

    public record EfficiencySnapshot(
            double wastedEnergy,
            int optimalRoutes,
            double adaptationLevel,
            List<LearningSample> learningCurve
    ) {
        public static final EfficiencySnapshot EMPTY = new EfficiencySnapshot(0.0d, 0, 0.0d, List.of());

        public EfficiencySnapshot {
            learningCurve = learningCurve == null ? List.of() : List.copyOf(learningCurve);
        }
    }

    public record EmergencySnapshot(int lowHealthWarps, int panicWarps, int rescueWarps, double lastEmergencyTime) {
        public static final EmergencySnapshot EMPTY = new EmergencySnapshot(0, 0, 0, 0.0d);
    }
}
