package org.orbitjump.warp.core;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.orbitjump.core.time.FrameClock;
import org.orbitjump.warp.config.WarpRuntimeConfig;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.DiscoveryRegistry;
import org.orbitjump.warp.context.WarpContext;
import org.orbitjump.warp.context.WarpTraveler;
import org.orbitjump.warp.cost.WarpCostEngine;
import org.orbitjump.warp.energy.EnergyPool;
import org.orbitjump.warp.hooks.WarpPresentationHooks;
import org.orbitjump.warp.memory.MemorySnapshot;
import org.orbitjump.warp.memory.MemoryStats;
import org.orbitjump.warp.memory.WarpMemory;
import org.orbitjump.warp.navigation.DestinationInRange;
import org.orbitjump.warp.navigation.RoutePlan;
import org.orbitjump.warp.navigation.SelectionOutcome;
import org.orbitjump.warp.navigation.WarpTargeting;
import org.orbitjump.warp.persistence.InMemoryKeyValueStore;
import org.orbitjump.warp.persistence.KeyValueStore;
import org.orbitjump.warp.persistence.WarpPersistence;
import org.orbitjump.warp.persistence.WarpSaveState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Composition root of the warp drive, built once per session.
 *
 * <p>{@link #update(double)} runs once per frame in a fixed order: clock advance, energy
 * regeneration, state-machine tick. Commits issued later in the same frame therefore see the
 * regenerated energy.</p>
 */
@Slf4j
@Accessors(fluent = true)
public final class WarpSubsystem {

    @Getter
    private final WarpRuntimeConfig config;
    @Getter
    private final FrameClock clock;
    @Getter
    private final EnergyPool energy;
    @Getter
    private final WarpMemory memory;
    @Getter
    private final WarpCostEngine costEngine;
    @Getter
    private final WarpStateMachine stateMachine;
    @Getter
    private final WarpTargeting targeting;
    private final WarpPersistence persistence;
    private final WarpTraveler player;

    /**
     * Wires the subsystem.
     *
     * @param config runtime configuration; defaults when {@code null}.
     * @param player local player.
     * @param clock session clock; a fresh one when {@code null}.
     * @param discovery discovery lookup; destination flags when {@code null}.
     * @param store persistence store; process-local when {@code null}.
     * @param hooks presentation subscribers.
     */
    @Builder
    private WarpSubsystem(
            WarpRuntimeConfig config,
            WarpTraveler player,
            FrameClock clock,
            DiscoveryRegistry discovery,
            KeyValueStore store,
            @Singular("hook") List<WarpPresentationHooks> hooks
    ) {
        this.config = (config == null ? WarpRuntimeConfig.defaults() : config).validate();
        this.player = Objects.requireNonNull(player, "player");
        this.clock = clock == null ? new FrameClock() : clock;
        DiscoveryRegistry registry = discovery == null ? DiscoveryRegistry.fromDestinationFlags() : discovery;
        this.energy = new EnergyPool(this.config);
        this.memory = new WarpMemory(this.config);
        this.costEngine = new WarpCostEngine(energy, memory, this.config.getCostFloorRatio());
        this.stateMachine = new WarpStateMachine(this.config, energy, memory, costEngine, registry, this.clock);
        this.targeting = new WarpTargeting(stateMachine, costEngine, registry, this.config.getSelectionRadius());
        this.persistence = new WarpPersistence(store == null ? new InMemoryKeyValueStore() : store);
        for (WarpPresentationHooks h : hooks) {
            stateMachine.subscribe(h);
        }
    }

    /**
     * Runs one frame.
     *
     * @param dtSeconds frame delta; finite and {@code >= 0}.
     */
    public void update(double dtSeconds) {
        clock.advance(dtSeconds);
        energy.regenerate(dtSeconds);
        stateMachine.tick(dtSeconds);
    }

    /**
     * Captures the player's current situation.
     */
    public WarpContext context() {
        return WarpContext.of(player, clock.nowSeconds());
    }

    /**
     * Live quote from the player's position to {@code destination}.
     */
    public int quote(Destination destination) {
        return costEngine.quote(player.position(), destination, context());
    }

    public boolean canCommit(Destination destination) {
        return stateMachine.canCommit(destination, player, context());
    }

    /**
     * Commits a warp priced against the player's current situation.
     */
    public CommitResult commit(Destination destination) {
        return stateMachine.commit(destination, player, context());
    }

    public void unlock() {
        stateMachine.unlock();
    }

    public void subscribe(WarpPresentationHooks hooks) {
        stateMachine.subscribe(hooks);
    }

    /**
     * Toggles selection mode.
     *
     * @return true when selection mode is active after the call.
     */
    public boolean toggleSelection() {
        return targeting.toggleSelection();
    }

    /**
     * Handles a selection click at a world position.
     */
    public SelectionOutcome selectAt(double worldX, double worldY, List<Destination> destinations) {
        return targeting.selectAndMaybeCommit(worldX, worldY, destinations, player, context());
    }

    public List<DestinationInRange> destinationsInRange(List<Destination> destinations, double maxRange) {
        return targeting.destinationsInRange(player, destinations, maxRange, context());
    }

    public RoutePlan planRoute(Destination destination) {
        return targeting.planRoute(player.position(), destination, context());
    }

    /**
     * Returns the HUD view of the drive.
     */
    public WarpStatus status() {
        WarpAttempt attempt = stateMachine.currentAttempt();
        return WarpStatus.builder()
                .state(stateMachine.state())
                .unlocked(stateMachine.unlocked())
                .energy(energy.status())
                .target(attempt == null ? null : attempt.destination())
                .progress(stateMachine.progress())
                .selected(targeting.selected())
                .build();
    }

    public MemoryStats memoryStats() {
        return memory.stats();
    }

    /**
     * Persists learned memory, energy and the unlock flag. Store failures are logged and
     * swallowed so a failing save never interrupts play.
     *
     * @return true when the state was written.
     */
    public boolean save() {
        try {
            persistence.save(new WarpSaveState(memory.toSnapshot(), energy.snapshot(), stateMachine.unlocked()));
            return true;
        } catch (RuntimeException ex) {
            log.warn("warp save failed", ex);
            return false;
        }
    }

    /**
     * Restores persisted state. With nothing stored, or when the store cannot be read, the
     * current state is kept; a corrupt save resets memory to fresh.
     *
     * @return true when a stored state was applied.
     */
    public boolean load() {
        Optional<WarpSaveState> loaded;
        try {
            if (!persistence.hasStoredState()) {
                return false;
            }
            loaded = persistence.load();
        } catch (RuntimeException ex) {
            log.warn("warp load failed; keeping current state", ex);
            return false;
        }
        if (loaded.isEmpty()) {
            memory.restore(MemorySnapshot.empty());
            return false;
        }
        WarpSaveState state = loaded.get();
        memory.restore(state.memory());
        if (state.energy() != null) {
            energy.restore(state.energy());
        }
        stateMachine.restoreUnlocked(state.unlocked() || config.isStartUnlocked());
        log.info("warp drive restored: {} warps, {} routes", memory.behavior().totalWarps(), memory.knownRouteCount());
        return true;
    }
}
