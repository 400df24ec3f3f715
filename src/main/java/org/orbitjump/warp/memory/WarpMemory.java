package org.orbitjump.warp.memory;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMap;
import it.unimi.dsi.fastutil.objects.ObjectIterator;
import lombok.extern.slf4j.Slf4j;
import org.orbitjump.core.id.DestinationId;
import org.orbitjump.warp.config.WarpRuntimeConfig;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.Position;
import org.orbitjump.warp.context.WarpContext;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded online model of how the player travels.
 *
 * <p>Read operations never mutate and answer unknown routes and destinations with neutral
 * multipliers, so a fresh memory prices every warp at its static cost. Write operations
 * ({@link #recordWarp}, {@link #recordFailedAttempt}, {@link #consolidate()}) are called only by
 * the warp state machine.</p>
 *
 * <p>Capacity policy: routes used fewer than {@code routeEvictionThreshold} times are evicted
 * and the learning curve is cut to {@code consolidatedCurveLength} samples every
 * {@code consolidationInterval} completed warps.</p>
 */
@Slf4j
public final class WarpMemory {

    private static final double NEUTRAL = 1.0d;

    private static final int FAMILIARITY_SATURATION_USES = 10;
    private static final double FAMILIARITY_MAX_DISCOUNT = 0.25d;

    private static final double MASTERY_MAX_DISCOUNT = 0.25d;
    private static final double MASTERY_OPTIMAL_WEIGHT = 0.5d;
    private static final double MASTERY_CALM_WEIGHT = 0.3d;
    private static final double MASTERY_EXPLORATION_WEIGHT = 0.2d;

    private static final double EXPLORATION_FIRST_VISIT = 0.85d;
    private static final double EXPLORATION_FEW_VISITS = 0.90d;
    private static final int EXPLORATION_FEW_VISITS_LIMIT = 2;

    private static final double AFFINITY_MAX_DISCOUNT = 0.15d;

    private static final double CRITICAL_HEALTH = 30.0d;
    private static final double LOW_HEALTH = 60.0d;
    private static final double CRITICAL_HEALTH_SIGNAL = 0.4d;
    private static final double LOW_HEALTH_SIGNAL = 0.2d;
    private static final double RAPID_REPEAT_SIGNAL = 0.3d;
    private static final double DANGER_SIGNAL = 0.4d;

    private static final double ADAPTATION_SCALE = 20.0d;

    private static final double SKILL_EFFICIENCY_WEIGHT = 0.4d;
    private static final double SKILL_EXPERIENCE_WEIGHT = 0.3d;
    private static final double SKILL_CALM_WEIGHT = 0.2d;
    private static final double SKILL_EXPLORATION_WEIGHT = 0.1d;
    private static final double SKILL_EXPERIENCE_WARPS = 50.0d;
    private static final double SKILL_EXPLORATION_SHARE = 0.3d;

    private final WarpRuntimeConfig config;
    private final Object2ObjectLinkedOpenHashMap<RouteKey, RouteStat> routes = new Object2ObjectLinkedOpenHashMap<>();
    private final Object2ObjectLinkedOpenHashMap<DestinationId, PlanetAffinity> affinities =
            new Object2ObjectLinkedOpenHashMap<>();
    private final BehaviorProfile behavior = new BehaviorProfile();
    private final EfficiencyMetrics efficiency;
    private final EmergencyPatterns emergencyPatterns = new EmergencyPatterns();
    private final ArrayDeque<FailedAttempt> failedAttempts;
    private long failedAttemptCount;
    private long totalDestinationVisits;

    /**
     * Creates an empty memory.
     */
    public WarpMemory(WarpRuntimeConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.efficiency = new EfficiencyMetrics(config.getLearningCurveCapacity());
        this.failedAttempts = new ArrayDeque<>(config.getFailedAttemptLogCapacity());
    }

    /**
     * Discount for a well-travelled route: {@code 1 - min(uses / 10, 1) * 0.25}.
     *
     * @return multiplier in {@code [0.75, 1.0]}; {@code 1.0} for unknown routes.
     */
    public double routeFamiliarityBonus(Position source, DestinationId destination) {
        if (source == null || destination == null) {
            return NEUTRAL;
        }
        RouteStat stat = routes.get(RouteKey.of(source, destination, config.getRouteCellSize()));
        if (stat == null) {
            return NEUTRAL;
        }
        double saturation = Math.min((double) stat.uses() / FAMILIARITY_SATURATION_USES, 1.0d);
        return NEUTRAL - saturation * FAMILIARITY_MAX_DISCOUNT;
    }

    /**
     * Discount for overall travel mastery.
     *
     * @return multiplier in {@code [0.75, 1.0]}; {@code 1.0} before the first warp.
     */
    public double masteryMultiplier() {
        int total = behavior.totalWarps();
        if (total == 0) {
            return NEUTRAL;
        }
        double optimalRatio = (double) efficiency.optimalRoutes() / total;
        double score = optimalRatio * MASTERY_OPTIMAL_WEIGHT
                + (1.0d - behavior.emergencyRatio()) * MASTERY_CALM_WEIGHT
                + behavior.explorationRatio() * MASTERY_EXPLORATION_WEIGHT;
        return Math.max(NEUTRAL - MASTERY_MAX_DISCOUNT, NEUTRAL - score * MASTERY_MAX_DISCOUNT);
    }

    /**
     * Discount that rewards discovery: 0.85 before the first visit, 0.90 for one or two prior
     * visits, 1.0 afterwards.
     */
    public double explorationBonus(DestinationId destination) {
        if (destination == null) {
            return NEUTRAL;
        }
        PlanetAffinity affinity = affinities.get(destination);
        int visits = affinity == null ? 0 : affinity.visits();
        if (visits == 0) {
            return EXPLORATION_FIRST_VISIT;
        }
        if (visits <= EXPLORATION_FEW_VISITS_LIMIT) {
            return EXPLORATION_FEW_VISITS;
        }
        return NEUTRAL;
    }

    /**
     * Discount for favourite destinations: {@code max(0.85, 1 - affinity * 0.15)}.
     */
    public double affinityBonus(DestinationId destination) {
        if (destination == null) {
            return NEUTRAL;
        }
        PlanetAffinity affinity = affinities.get(destination);
        if (affinity == null) {
            return NEUTRAL;
        }
        return Math.max(NEUTRAL - AFFINITY_MAX_DISCOUNT, NEUTRAL - affinity.affinity() * AFFINITY_MAX_DISCOUNT);
    }

    /**
     * Emergency score of {@code context} in {@code [0, 1]}; {@code 0} for a missing context.
     */
    public double detectEmergency(WarpContext context) {
        return evaluateSignals(context).score();
    }

    /**
     * Evaluates every emergency signal of {@code context} against the current memory.
     */
    public EmergencySignals evaluateSignals(WarpContext context) {
        if (context == null) {
            return EmergencySignals.NONE;
        }
        double score = 0.0d;
        boolean critical = context.health() < CRITICAL_HEALTH;
        boolean low = context.health() < LOW_HEALTH;
        if (critical) {
            score += CRITICAL_HEALTH_SIGNAL;
        } else if (low) {
            score += LOW_HEALTH_SIGNAL;
        }
        boolean rapid = withinWindow(context.nowSeconds(), config.getPanicWindowSeconds());
        if (rapid) {
            score += RAPID_REPEAT_SIGNAL;
        }
        boolean danger = context.hasNearbyDanger();
        if (danger) {
            score += DANGER_SIGNAL;
        }
        return new EmergencySignals(critical, low, rapid, danger, Math.min(1.0d, score));
    }

    /**
     * Returns usage statistics of a route, if it is remembered.
     */
    public Optional<RouteStat> route(Position source, DestinationId destination) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        return Optional.ofNullable(routes.get(RouteKey.of(source, destination, config.getRouteCellSize())));
    }

    /**
     * Returns visit statistics of a destination, if it was ever visited.
     */
    public Optional<PlanetAffinity> affinity(DestinationId destination) {
        return Optional.ofNullable(affinities.get(Objects.requireNonNull(destination, "destination")));
    }

    public int knownRouteCount() {
        return routes.size();
    }

    public int knownDestinationCount() {
        return affinities.size();
    }

    public BehaviorProfile behavior() {
        return behavior;
    }

    public EfficiencyMetrics efficiency() {
        return efficiency;
    }

    public EmergencyPatterns emergencyPatterns() {
        return emergencyPatterns;
    }

    /**
     * Returns the most recent rejected attempts, oldest first.
     */
    public List<FailedAttempt> recentFailedAttempts() {
        return List.copyOf(failedAttempts);
    }

    /**
     * Returns the number of rejected attempts since this memory was created.
     */
    public long failedAttemptCount() {
        return failedAttemptCount;
    }

    /**
     * Returns an immutable summary for HUD and debug overlays.
     */
    public MemoryStats stats() {
        int total = behavior.totalWarps();
        return MemoryStats.builder()
                .totalWarps(total)
                .knownRoutes(routes.size())
                .efficiency((double) efficiency.optimalRoutes() / Math.max(1, total))
                .skillLevel(behavior.skillLevel())
                .adaptationLevel(efficiency.adaptationLevel())
                .knownDestinations(affinities.size())
                .emergencyRate(behavior.emergencyRatio())
                .failedAttempts(failedAttemptCount)
                .build();
    }

    /**
     * Learns from one completed warp.
     *
     * @param source where the warp started.
     * @param destination where the warp ended.
     * @param actualCost price paid; finite and {@code >= 0}.
     * @param context situation at arrival; its time stamps the warp.
     */
    public void recordWarp(Position source, Destination destination, double actualCost, WarpContext context) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(context, "context");
        if (!Double.isFinite(actualCost) || actualCost < 0.0d) {
            throw new IllegalArgumentException("actualCost must be finite and >= 0, got " + actualCost);
        }
        double now = context.nowSeconds();
        EmergencySignals signals = evaluateSignals(context);
        boolean chained = withinWindow(now, config.getChainWindowSeconds());

        RouteKey routeKey = RouteKey.of(source, destination.id(), config.getRouteCellSize());
        RouteStat stat = routes.get(routeKey);
        if (stat == null) {
            stat = new RouteStat();
            routes.put(routeKey, stat);
        }
        stat.record(actualCost);

        behavior.countWarp(source.distanceTo(destination.position()));
        if (signals.isEmergency()) {
            behavior.countEmergency();
        }
        emergencyPatterns.record(signals, now);
        if (chained) {
            behavior.countChain();
        }
        behavior.stampWarpTime(now);

        PlanetAffinity affinity = affinities.get(destination.id());
        if (affinity == null) {
            affinity = new PlanetAffinity();
            affinities.put(destination.id(), affinity);
        }
        if (affinity.visits() == 0) {
            behavior.countExploration();
        } else {
            behavior.countReturn();
        }
        affinity.visit(now);
        totalDestinationVisits++;
        renormalizeAffinities();

        learnCost(now, actualCost);
        recalculateSkillLevel();

        log.debug(
                "learned warp to {} cost={} emergency={} chained={}",
                destination.id(),
                actualCost,
                signals.score(),
                chained
        );

        if (behavior.totalWarps() % config.getConsolidationInterval() == 0) {
            consolidate();
        }
    }

    /**
     * Logs a rejected attempt. Learned aggregates are left untouched.
     */
    public void recordFailedAttempt(
            DestinationId destination,
            String reasonCode,
            double costNeeded,
            double energyAvailable,
            double now
    ) {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (failedAttempts.size() == config.getFailedAttemptLogCapacity()) {
            failedAttempts.pollFirst();
        }
        double shortfall = Math.max(0.0d, costNeeded - energyAvailable);
        failedAttempts.addLast(new FailedAttempt(destination, reasonCode, costNeeded, energyAvailable, shortfall, now));
        failedAttemptCount++;
        log.debug("rejected warp to {} reason={} needed={} available={}", destination, reasonCode, costNeeded, energyAvailable);
    }

    /**
     * Compacts the memory: evicts rarely used routes, cuts the learning curve to its most recent
     * samples and recomputes the skill level.
     */
    public void consolidate() {
        int before = routes.size();
        ObjectIterator<Object2ObjectMap.Entry<RouteKey, RouteStat>> it = routes.object2ObjectEntrySet().fastIterator();
        while (it.hasNext()) {
            if (it.next().getValue().uses() < config.getRouteEvictionThreshold()) {
                it.remove();
            }
        }
        efficiency.learningCurve().retainMostRecent(config.getConsolidatedCurveLength());
        recalculateSkillLevel();
        log.info(
                "consolidated warp memory: routes {} -> {}, curve samples {}",
                before,
                routes.size(),
                efficiency.learningCurve().size()
        );
    }

    /**
     * Captures the learned state for persistence.
     */
    public MemorySnapshot toSnapshot() {
        List<MemorySnapshot.RouteEntry> routeEntries = new ArrayList<>(routes.size());
        for (Map.Entry<RouteKey, RouteStat> e : routes.object2ObjectEntrySet()) {
            routeEntries.add(new MemorySnapshot.RouteEntry(e.getKey(), e.getValue().uses(), e.getValue().totalCostPaid()));
        }
        List<MemorySnapshot.AffinityEntry> affinityEntries = new ArrayList<>(affinities.size());
        for (Map.Entry<DestinationId, PlanetAffinity> e : affinities.object2ObjectEntrySet()) {
            PlanetAffinity a = e.getValue();
            affinityEntries.add(new MemorySnapshot.AffinityEntry(e.getKey(), a.visits(), a.lastVisitTime(), a.affinity()));
        }
        return new MemorySnapshot(
                routeEntries,
                new MemorySnapshot.BehaviorSnapshot(
                        behavior.totalWarps(),
                        behavior.emergencyWarps(),
                        behavior.explorationWarps(),
                        behavior.returnWarps(),
                        behavior.warpChains(),
                        behavior.lastWarpTime(),
                        behavior.averageWarpDistance(),
                        behavior.skillLevel()
                ),
                affinityEntries,
                new MemorySnapshot.EfficiencySnapshot(
                        efficiency.wastedEnergy(),
                        efficiency.optimalRoutes(),
                        efficiency.adaptationLevel(),
                        efficiency.learningCurve().samples()
                ),
                new MemorySnapshot.EmergencySnapshot(
                        emergencyPatterns.lowHealthWarps(),
                        emergencyPatterns.panicWarps(),
                        emergencyPatterns.rescueWarps(),
                        emergencyPatterns.lastEmergencyTime()
                )
        );
    }

    /**
     * Rebuilds a memory from a persisted snapshot.
     */
    public static WarpMemory fromSnapshot(WarpRuntimeConfig config, MemorySnapshot snapshot) {
        WarpMemory memory = new WarpMemory(config);
        memory.restore(snapshot);
        return memory;
    }

    /**
     * Replaces the learned state with {@code snapshot}. The failed-attempt log is session data
     * and is kept.
     *
     * <p>Negative counters are clamped to zero. Affinities and the skill level are derived values
     * and are recomputed rather than trusted.</p>
     */
    public void restore(MemorySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        routes.clear();
        affinities.clear();
        totalDestinationVisits = 0L;
        efficiency.learningCurve().clear();

        for (MemorySnapshot.RouteEntry entry : snapshot.routes()) {
            routes.put(entry.key(), new RouteStat(Math.max(0, entry.uses()), nonNegative(entry.totalCostPaid())));
        }
        for (MemorySnapshot.AffinityEntry entry : snapshot.affinities()) {
            int visits = Math.max(0, entry.visits());
            affinities.put(entry.destination(), new PlanetAffinity(visits, nonNegative(entry.lastVisitTime())));
            totalDestinationVisits += visits;
        }
        renormalizeAffinities();

        MemorySnapshot.BehaviorSnapshot b = snapshot.behavior();
        behavior.restore(
                Math.max(0, b.totalWarps()),
                Math.max(0, b.emergencyWarps()),
                Math.max(0, b.explorationWarps()),
                Math.max(0, b.returnWarps()),
                Math.max(0, b.warpChains()),
                nonNegative(b.lastWarpTime()),
                nonNegative(b.averageWarpDistance())
        );

        MemorySnapshot.EfficiencySnapshot e = snapshot.efficiency();
        efficiency.restore(nonNegative(e.wastedEnergy()), Math.max(0, e.optimalRoutes()), clampUnit(e.adaptationLevel()));
        for (LearningSample sample : e.learningCurve()) {
            if (sample != null) {
                efficiency.learningCurve().add(sample);
            }
        }

        MemorySnapshot.EmergencySnapshot em = snapshot.emergency();
        emergencyPatterns.restore(
                Math.max(0, em.lowHealthWarps()),
                Math.max(0, em.panicWarps()),
                Math.max(0, em.rescueWarps()),
                nonNegative(em.lastEmergencyTime())
        );
        recalculateSkillLevel();
        log.debug("restored warp memory: {} routes, {} destinations, {} warps", routes.size(), affinities.size(), b.totalWarps());
    }

    private void learnCost(double now, double cost) {
        boolean optimal = cost <= config.getOptimalCostThreshold();
        if (optimal) {
            efficiency.countOptimal();
        }
        efficiency.addWaste(Math.max(0.0d, cost - config.getOptimalCostThreshold()));
        LearningCurve curve = efficiency.learningCurve();
        curve.add(new LearningSample(now, cost, optimal));

        int window = config.getAdaptationWindow();
        if (curve.size() < window) {
            return;
        }
        double[] recent = curve.recentCosts(window);
        double totalDrop = 0.0d;
        for (int i = 1; i < recent.length; i++) {
            totalDrop += recent[i - 1] - recent[i];
        }
        double meanDrop = totalDrop / (recent.length - 1);
        efficiency.updateAdaptationLevel(clampUnit(meanDrop / ADAPTATION_SCALE));
    }

    /**
     * Whether the previous warp happened less than {@code window} seconds before {@code now}.
     * A previous warp stamped after {@code now} belongs to an earlier session and never counts.
     */
    private boolean withinWindow(double now, double window) {
        if (behavior.totalWarps() == 0) {
            return false;
        }
        double elapsed = now - behavior.lastWarpTime();
        return elapsed >= 0.0d && elapsed < window;
    }

    private void renormalizeAffinities() {
        for (PlanetAffinity affinity : affinities.values()) {
            affinity.renormalize(totalDestinationVisits);
        }
    }

    private void recalculateSkillLevel() {
        int total = behavior.totalWarps();
        if (total == 0) {
            behavior.updateSkillLevel(0.0d);
            return;
        }
        double efficiencyScore = Math.min(1.0d, (double) efficiency.optimalRoutes() / total);
        double experience = Math.min(1.0d, total / SKILL_EXPERIENCE_WARPS);
        double calm = 1.0d - Math.min(1.0d, behavior.emergencyRatio());
        double courage = Math.min(
                1.0d,
                behavior.explorationWarps() / Math.max(1.0d, total * SKILL_EXPLORATION_SHARE)
        );
        behavior.updateSkillLevel(
                efficiencyScore * SKILL_EFFICIENCY_WEIGHT
                        + experience * SKILL_EXPERIENCE_WEIGHT
                        + calm * SKILL_CALM_WEIGHT
                        + courage * SKILL_EXPLORATION_WEIGHT
        );
    }

    private static double nonNegative(double value) {
        return Double.isFinite(value) && value > 0.0d ? value : 0.0d;
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, value));
    }
}
