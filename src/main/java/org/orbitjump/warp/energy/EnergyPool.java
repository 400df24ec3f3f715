package org.orbitjump.warp.energy;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.orbitjump.warp.config.WarpRuntimeConfig;

import java.util.Objects;

/**
 * Capped, regenerating warp energy.
 *
 * <p>Invariant: {@code 0 <= current <= max} after every public call. The pool is mutated only
 * by {@link #regenerate(double)}, {@link #consume(double)}, pickups ({@link #add(double)}),
 * upgrades and state restore. Consumption is all-or-nothing: an unaffordable request leaves
 * the pool untouched.</p>
 *
 * <p>Static pricing also lives here: {@link #baseCost(double)} is the distance-based floor
 * beneath every learned adjustment.</p>
 */
@Accessors(fluent = true)
public final class EnergyPool {

    private static final double CAPACITY_STEP_PER_LEVEL = 0.20d;
    private static final double REGEN_STEP_PER_LEVEL = 0.25d;

    private final double baseMax;
    private final double baseRegenPerSecond;
    @Getter
    private final int minimumCost;
    @Getter
    private final double distancePerCostUnit;

    @Getter
    private double current;
    @Getter
    private double max;
    @Getter
    private double regenPerSecond;
    @Getter
    private boolean regenerationSuspended;

    /**
     * Creates a full pool from runtime configuration.
     */
    public EnergyPool(WarpRuntimeConfig config) {
        this(
                Objects.requireNonNull(config, "config").getMaxEnergy(),
                config.getRegenPerSecond(),
                config.getMinimumCost(),
                config.getDistancePerCostUnit()
        );
    }

    /**
     * Creates a full pool.
     *
     * @param max capacity; must be finite and {@code > 0}.
     * @param regenPerSecond regeneration rate; must be finite and {@code >= 0}.
     * @param minimumCost cheapest static price; must be {@code >= 0}.
     * @param distancePerCostUnit distance covered by one cost unit; must be finite and {@code > 0}.
     */
    public EnergyPool(double max, double regenPerSecond, int minimumCost, double distancePerCostUnit) {
        requirePositive(max, "max");
        requireNonNegative(regenPerSecond, "regenPerSecond");
        if (minimumCost < 0) {
            throw new IllegalArgumentException("minimumCost must be >= 0, got " + minimumCost);
        }
        requirePositive(distancePerCostUnit, "distancePerCostUnit");
        this.baseMax = max;
        this.baseRegenPerSecond = regenPerSecond;
        this.minimumCost = minimumCost;
        this.distancePerCostUnit = distancePerCostUnit;
        this.max = max;
        this.current = max;
        this.regenPerSecond = regenPerSecond;
    }

    /**
     * Returns whether {@code cost} can be paid right now.
     */
    public boolean hasEnergy(double cost) {
        return !Double.isNaN(cost) && cost <= current;
    }

    /**
     * Pays {@code cost} if affordable.
     *
     * @param cost non-negative price.
     * @return true when paid; false (pool unchanged) when insufficient.
     */
    public boolean consume(double cost) {
        requireNonNegative(cost, "cost");
        if (cost > current) {
            return false;
        }
        current = clamp(current - cost);
        return true;
    }

    /**
     * Applies one frame of regeneration: {@code current = min(max, current + regen * dt)}.
     * No-op while regeneration is suspended.
     *
     * @param dtSeconds frame delta; must be finite and {@code >= 0}.
     */
    public void regenerate(double dtSeconds) {
        requireNonNegative(dtSeconds, "dtSeconds");
        if (regenerationSuspended || current >= max) {
            return;
        }
        current = Math.min(max, current + regenPerSecond * dtSeconds);
    }

    /**
     * Suspends or resumes regeneration. The warp state machine holds regeneration suspended
     * for the whole in-flight phase of a warp.
     */
    public void setRegenerationSuspended(boolean suspended) {
        this.regenerationSuspended = suspended;
    }

    /**
     * Adds energy from pickups or bonuses, clamped to capacity.
     *
     * @param amount non-negative amount.
     */
    public void add(double amount) {
        requireNonNegative(amount, "amount");
        current = Math.min(max, current + amount);
    }

    /**
     * Changes capacity while keeping the current fill ratio ({@code current} is floored).
     *
     * @param newMax new capacity; must be finite and {@code > 0}.
     */
    public void setMax(double newMax) {
        requirePositive(newMax, "newMax");
        double ratio = current / max;
        max = newMax;
        current = clamp(Math.floor(newMax * ratio));
    }

    /**
     * Applies a capacity upgrade: each level adds 20% of the base capacity.
     *
     * @param level upgrade level; must be {@code >= 0}.
     */
    public void upgradeCapacity(int level) {
        requireLevel(level);
        setMax(baseMax * (1.0d + level * CAPACITY_STEP_PER_LEVEL));
    }

    /**
     * Applies a regeneration upgrade: each level adds 25% of the base rate.
     *
     * @param level upgrade level; must be {@code >= 0}.
     */
    public void upgradeRegeneration(int level) {
        requireLevel(level);
        regenPerSecond = baseRegenPerSecond * (1.0d + level * REGEN_STEP_PER_LEVEL);
    }

    /**
     * Returns fill ratio in {@code [0, 1]}.
     */
    public double percent() {
        return current / max;
    }

    /**
     * Static distance price: {@code max(minimumCost, floor(distance / distancePerCostUnit))}.
     *
     * <p>Infinite distance saturates to {@link Integer#MAX_VALUE}, which no pool can afford.</p>
     *
     * @param distance non-negative travel distance.
     * @return static cost in integer energy units.
     */
    public int baseCost(double distance) {
        if (Double.isNaN(distance) || distance < 0.0d) {
            throw new IllegalArgumentException("distance must be >= 0 and not NaN, got " + distance);
        }
        // double-to-int narrowing saturates at Integer.MAX_VALUE
        int scaled = (int) Math.floor(distance / distancePerCostUnit);
        return Math.max(minimumCost, scaled);
    }

    /**
     * Returns a read-only status view for HUD collaborators.
     */
    public EnergyStatus status() {
        return EnergyStatus.builder()
                .current(current)
                .max(max)
                .percent(percent())
                .regenPerSecond(regenPerSecond)
                .regenerationSuspended(regenerationSuspended)
                .build();
    }

    /**
     * Captures persistable state.
     */
    public EnergySnapshot snapshot() {
        return new EnergySnapshot(current, max, regenPerSecond);
    }

    /**
     * Restores persisted state. Out-of-domain values are repaired instead of rejected:
     * a non-positive capacity or negative rate keeps the live value, and {@code current}
     * is clamped into {@code [0, max]}.
     *
     * @param snapshot persisted state.
     */
    public void restore(EnergySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (Double.isFinite(snapshot.max()) && snapshot.max() > 0.0d) {
            max = snapshot.max();
        }
        if (Double.isFinite(snapshot.regenPerSecond()) && snapshot.regenPerSecond() >= 0.0d) {
            regenPerSecond = snapshot.regenPerSecond();
        }
        current = Double.isNaN(snapshot.current()) ? max : clamp(snapshot.current());
    }

    private double clamp(double value) {
        return Math.max(0.0d, Math.min(max, value));
    }

    private static void requireLevel(int level) {
        if (level < 0) {
            throw new IllegalArgumentException("upgrade level must be >= 0, got " + level);
        }
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and > 0, got " + value);
        }
    }

    private static void requireNonNegative(double value, String name) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and >= 0, got " + value);
        }
    }
}
