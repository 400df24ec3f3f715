package org.orbitjump.warp.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.orbitjump.core.time.FrameClock;
import org.orbitjump.warp.config.WarpRuntimeConfig;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.DiscoveryRegistry;
import org.orbitjump.warp.context.PlayerModel;
import org.orbitjump.warp.context.WarpContext;
import org.orbitjump.warp.context.WarpTraveler;
import org.orbitjump.warp.cost.WarpCostEngine;
import org.orbitjump.warp.energy.EnergyPool;
import org.orbitjump.warp.hooks.WarpArrived;
import org.orbitjump.warp.hooks.WarpCommitted;
import org.orbitjump.warp.hooks.WarpPresentationHooks;
import org.orbitjump.warp.memory.WarpMemory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Warp lifecycle: {@code IDLE -> SELECTING (optional) -> WARPING -> ARRIVED -> IDLE}.
 *
 * <p>The machine is the only writer of learned memory and the only caller of presentation
 * hooks. Energy is paid in full at commit and regeneration stays suspended while the warp is in
 * flight. A committed warp always completes; there is no cancellation.</p>
 */
@Slf4j
@Accessors(fluent = true)
public final class WarpStateMachine {

    private final EnergyPool energy;
    private final WarpMemory memory;
    private final WarpCostEngine costEngine;
    private final DiscoveryRegistry discovery;
    private final FrameClock clock;
    private final double warpDurationSeconds;
    private final double arrivalStandoff;
    private final List<WarpPresentationHooks> subscribers = new ArrayList<>();

    @Getter
    private WarpState state = WarpState.IDLE;
    @Getter
    private boolean unlocked;
    private WarpAttempt attempt;
    private WarpTraveler traveler;

    /**
     * Creates an idle machine; locked unless {@code config.startUnlocked} is set.
     */
    public WarpStateMachine(
            WarpRuntimeConfig config,
            EnergyPool energy,
            WarpMemory memory,
            WarpCostEngine costEngine,
            DiscoveryRegistry discovery,
            FrameClock clock
    ) {
        Objects.requireNonNull(config, "config");
        this.energy = Objects.requireNonNull(energy, "energy");
        this.memory = Objects.requireNonNull(memory, "memory");
        this.costEngine = Objects.requireNonNull(costEngine, "costEngine");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.warpDurationSeconds = config.getWarpDurationSeconds();
        this.arrivalStandoff = config.getArrivalStandoff();
        this.unlocked = config.isStartUnlocked();
    }

    /**
     * Registers a presentation subscriber.
     */
    public void subscribe(WarpPresentationHooks hooks) {
        subscribers.add(Objects.requireNonNull(hooks, "hooks"));
    }

    /**
     * Removes a presentation subscriber.
     *
     * @return true when it was registered.
     */
    public boolean unsubscribe(WarpPresentationHooks hooks) {
        return subscribers.remove(hooks);
    }

    /**
     * Unlocks the drive. Idempotent; the unlock hook fires once.
     */
    public void unlock() {
        if (unlocked) {
            return;
        }
        unlocked = true;
        log.info("warp drive unlocked");
        fire("unlocked", WarpPresentationHooks::onWarpDriveUnlocked);
    }

    /**
     * Restores the lock flag from a save without firing hooks.
     */
    public void restoreUnlocked(boolean unlocked) {
        this.unlocked = unlocked;
    }

    /**
     * Enters selection mode from idle.
     *
     * @return true when selection mode is now active.
     */
    public boolean enterSelection() {
        if (!unlocked || (state != WarpState.IDLE && state != WarpState.SELECTING)) {
            return false;
        }
        state = WarpState.SELECTING;
        return true;
    }

    /**
     * Leaves selection mode; no-op in any other state.
     */
    public void exitSelection() {
        if (state == WarpState.SELECTING) {
            state = WarpState.IDLE;
        }
    }

    /**
     * Returns whether a commit would be accepted right now.
     */
    public boolean canCommit(Destination destination, PlayerModel player, WarpContext context) {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(player, "player");
        return acceptsCommit()
                && unlocked
                && discovery.isDiscovered(destination)
                && energy.hasEnergy(costEngine.quote(player.position(), destination, context));
    }

    /**
     * Pays for and starts a warp.
     *
     * <p>Rejections leave state and energy untouched, are logged to memory as failed attempts and
     * reach subscribers through {@link WarpPresentationHooks#onWarpFailed}.</p>
     *
     * @param destination warp target.
     * @param player traveler relocated on arrival.
     * @param context situation used for pricing, or {@code null} for a static price.
     * @return commit outcome.
     */
    public CommitResult commit(Destination destination, WarpTraveler player, WarpContext context) {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(player, "player");
        double now = clock.nowSeconds();
        int cost = costEngine.quote(player.position(), destination, context);
        double available = energy.current();

        WarpFailureReason reason = null;
        if (!acceptsCommit()) {
            reason = WarpFailureReason.ALREADY_WARPING;
        } else if (!unlocked) {
            reason = WarpFailureReason.LOCKED;
        } else if (!discovery.isDiscovered(destination)) {
            reason = WarpFailureReason.UNDISCOVERED;
        } else if (!energy.consume(cost)) {
            reason = WarpFailureReason.INSUFFICIENT_ENERGY;
        }

        if (reason != null) {
            memory.recordFailedAttempt(destination.id(), reason.code(), cost, available, now);
            WarpFailureReason failure = reason;
            fire("failed", hooks -> hooks.onWarpFailed(failure));
            return CommitResult.rejected(destination, cost, available, reason);
        }

        energy.setRegenerationSuspended(true);
        attempt = new WarpAttempt(player.position(), destination, cost, now, context);
        traveler = player;
        state = WarpState.WARPING;
        log.debug("warp committed to {} cost={} energy {} -> {}", destination.id(), cost, available, energy.current());
        WarpCommitted event = WarpCommitted.of(destination, cost);
        fire("committed", hooks -> hooks.onWarpCommitted(event));
        return CommitResult.accepted(destination, cost, available, energy.current());
    }

    /**
     * Advances the lifecycle by one frame.
     *
     * @param dtSeconds frame delta; finite and {@code >= 0}.
     */
    public void tick(double dtSeconds) {
        if (!Double.isFinite(dtSeconds) || dtSeconds < 0.0d) {
            throw new IllegalArgumentException("dtSeconds must be finite and >= 0, got " + dtSeconds);
        }
        switch (state) {
            case ARRIVED -> state = WarpState.IDLE;
            case WARPING -> {
                if (attempt.advance(dtSeconds / warpDurationSeconds)) {
                    arrive();
                }
            }
            default -> {
            }
        }
    }

    /**
     * Returns the in-flight warp, or {@code null}.
     */
    public WarpAttempt currentAttempt() {
        return attempt;
    }

    /**
     * Returns progress of the in-flight warp; {@code 0} when none.
     */
    public double progress() {
        return attempt == null ? 0.0d : attempt.progress();
    }

    private void arrive() {
        WarpAttempt finished = attempt;
        Destination destination = finished.destination();
        double now = clock.nowSeconds();
        double arrivalX = destination.x() + destination.radius() + arrivalStandoff;
        double arrivalY = destination.y();

        WarpTraveler arriving = traveler;
        state = WarpState.ARRIVED;
        attempt = null;
        traveler = null;
        energy.setRegenerationSuspended(false);
        try {
            arriving.placeAt(arrivalX, arrivalY);
        } catch (RuntimeException ex) {
            log.error("could not place traveler at {} on arrival", destination.id(), ex);
        }

        WarpContext learned = finished.context() == null
                ? WarpContext.calm(now)
                : finished.context().withNowSeconds(now);
        memory.recordWarp(finished.source(), destination, finished.cost(), learned);
        log.debug("warp arrived at {} after {}s", destination.id(), now - finished.startTime());

        WarpArrived event = WarpArrived.of(destination, finished.cost(), arrivalX, arrivalY);
        fire("arrived", hooks -> hooks.onWarpArrived(event));
    }

    private boolean acceptsCommit() {
        return state == WarpState.IDLE || state == WarpState.SELECTING;
    }

    private void fire(String event, Consumer<WarpPresentationHooks> action) {
        for (WarpPresentationHooks hooks : List.copyOf(subscribers)) {
            try {
                action.accept(hooks);
            } catch (RuntimeException ex) {
                log.error("presentation subscriber {} failed on {}", hooks, event, ex);
            }
        }
    }
}
