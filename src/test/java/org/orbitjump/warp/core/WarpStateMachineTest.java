package org.orbitjump.warp.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.orbitjump.warp.config.WarpRuntimeConfig;
import org.orbitjump.warp.context.Danger;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.WarpContext;
import org.orbitjump.warp.hooks.WarpArrived;
import org.orbitjump.warp.hooks.WarpCommitted;
import org.orbitjump.warp.hooks.WarpPresentationHooks;
import org.orbitjump.warp.memory.FailedAttempt;
import org.orbitjump.warp.testutil.FakeTraveler;
import org.orbitjump.warp.testutil.RecordingHooks;
import org.orbitjump.warp.testutil.WarpFixtures;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WarpStateMachine Tests")
class WarpStateMachineTest {

    private static final Destination TARGET = WarpFixtures.planet("target", 2500.0d, 0.0d);

    private static void step(WarpFixtures.Fixture fixture, double dt) {
        fixture.clock().advance(dt);
        fixture.energy().regenerate(dt);
        fixture.stateMachine().tick(dt);
    }

    @Test
    @DisplayName("Drive starts locked and rejects commits with LOCKED")
    void testLockedByDefault() {
        WarpFixtures.Fixture fixture = WarpFixtures.createFixture(WarpRuntimeConfig.defaults());
        RecordingHooks hooks = new RecordingHooks();
        fixture.stateMachine().subscribe(hooks);

        CommitResult result = fixture.stateMachine().commit(TARGET, new FakeTraveler(0, 0), null);

        assertFalse(result.isSuccess());
        assertEquals(WarpFailureReason.LOCKED, result.getFailureReason());
        assertEquals(WarpState.IDLE, fixture.stateMachine().state());
        assertEquals(1000.0d, fixture.energy().current());
        assertEquals(1, hooks.failures.size());
        assertEquals("W_LOCKED", fixture.memory().recentFailedAttempts().get(0).reasonCode());
        assertFalse(fixture.stateMachine().enterSelection());
    }

    @Test
    @DisplayName("Unlock fires its hook exactly once")
    void testUnlockIdempotent() {
        WarpFixtures.Fixture fixture = WarpFixtures.createFixture(WarpRuntimeConfig.defaults());
        RecordingHooks hooks = new RecordingHooks();
        fixture.stateMachine().subscribe(hooks);

        fixture.stateMachine().unlock();
        fixture.stateMachine().unlock();

        assertTrue(fixture.stateMachine().unlocked());
        assertEquals(1, hooks.unlocks);
    }

    @Test
    @DisplayName("Statically priced commit pays 50 for a 2500 unit warp")
    void testStaticCommit() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        RecordingHooks hooks = new RecordingHooks();
        fixture.stateMachine().subscribe(hooks);

        CommitResult result = fixture.stateMachine().commit(TARGET, new FakeTraveler(0, 0), null);

        assertTrue(result.isSuccess());
        assertEquals(50, result.getCost());
        assertEquals(950.0d, result.getEnergyAfter(), 1e-9);
        assertEquals(950.0d, fixture.energy().current(), 1e-9);
        assertEquals(WarpState.WARPING, fixture.stateMachine().state());
        assertTrue(fixture.energy().regenerationSuspended());

        WarpCommitted event = hooks.committed.get(0);
        assertEquals(50, event.cost());
        assertEquals(0.84d, event.soundPitch(), 1e-12);
        assertEquals(25, event.particleCount());
    }

    @Test
    @DisplayName("Warp completes after its duration, relocates the player and learns once")
    void testLifecycle() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        RecordingHooks hooks = new RecordingHooks();
        FakeTraveler player = new FakeTraveler(0, 0);
        fixture.stateMachine().subscribe(hooks);
        fixture.stateMachine().commit(TARGET, player, null);

        step(fixture, 1.0d);
        assertEquals(WarpState.WARPING, fixture.stateMachine().state());
        assertEquals(0.5d, fixture.stateMachine().progress(), 1e-12);
        assertEquals(950.0d, fixture.energy().current(), 1e-9);
        assertEquals(0, fixture.memory().behavior().totalWarps());

        step(fixture, 1.0d);
        assertEquals(WarpState.ARRIVED, fixture.stateMachine().state());
        assertNull(fixture.stateMachine().currentAttempt());
        assertFalse(fixture.energy().regenerationSuspended());
        assertEquals(2570.0d, player.x(), 1e-9);
        assertEquals(0.0d, player.y(), 1e-9);
        assertEquals(1, player.placements());
        assertEquals(1, fixture.memory().behavior().totalWarps());
        assertEquals(2.0d, fixture.memory().behavior().lastWarpTime(), 1e-12);

        WarpArrived arrived = hooks.arrived.get(0);
        assertEquals(TARGET, arrived.destination());
        assertEquals(50, arrived.costPaid());
        assertEquals(15.0d, arrived.shakeIntensity());
        assertEquals(0.3d, arrived.shakeSeconds());

        step(fixture, 1.0d);
        assertEquals(WarpState.IDLE, fixture.stateMachine().state());
        assertEquals(1000.0d, fixture.energy().current(), 1e-9);

        step(fixture, 5.0d);
        assertEquals(1, fixture.memory().behavior().totalWarps());
        assertEquals(1, hooks.arrived.size());
    }

    @Test
    @DisplayName("A failing placement still finishes the warp, resumes regeneration and learns")
    void testArrivalSurvivesPlacementFailure() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        RecordingHooks hooks = new RecordingHooks();
        FakeTraveler player = new FakeTraveler(0, 0)
                .failPlacementsWith(new IllegalStateException("physics body destroyed"));
        fixture.stateMachine().subscribe(hooks);
        fixture.stateMachine().commit(TARGET, player, null);

        assertDoesNotThrow(() -> step(fixture, 2.0d));
        assertAll(
                () -> assertEquals(WarpState.ARRIVED, fixture.stateMachine().state()),
                () -> assertNull(fixture.stateMachine().currentAttempt()),
                () -> assertFalse(fixture.energy().regenerationSuspended()),
                () -> assertEquals(0, player.placements()),
                () -> assertEquals(1, fixture.memory().behavior().totalWarps()),
                () -> assertEquals(1, hooks.arrived.size())
        );

        for (int i = 0; i < 100; i++) {
            step(fixture, 0.016d);
        }
        assertEquals(WarpState.IDLE, fixture.stateMachine().state());
        assertEquals(1000.0d, fixture.energy().current(), 1e-9);
        assertTrue(fixture.stateMachine().commit(TARGET, new FakeTraveler(2570, 0), null).isSuccess());
    }

    @Test
    @DisplayName("Unaffordable commit is rejected and recorded without spending energy")
    void testInsufficientEnergy() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        RecordingHooks hooks = new RecordingHooks();
        fixture.stateMachine().subscribe(hooks);
        fixture.energy().consume(990.0d);

        FakeTraveler player = new FakeTraveler(0, 0);
        assertFalse(fixture.stateMachine().canCommit(TARGET, player, null));
        CommitResult result = fixture.stateMachine().commit(TARGET, player, null);

        assertFalse(result.isSuccess());
        assertEquals(WarpFailureReason.INSUFFICIENT_ENERGY, result.getFailureReason());
        assertEquals(10.0d, fixture.energy().current(), 1e-9);
        assertEquals(WarpState.IDLE, fixture.stateMachine().state());
        assertEquals(WarpFailureReason.INSUFFICIENT_ENERGY, hooks.failures.get(0));
        assertTrue(hooks.committed.isEmpty());

        FailedAttempt attempt = fixture.memory().recentFailedAttempts().get(0);
        assertEquals(TARGET.id(), attempt.destination());
        assertEquals(50.0d, attempt.costNeeded());
        assertEquals(40.0d, attempt.shortfall(), 1e-9);
        assertEquals(0, fixture.memory().behavior().totalWarps());
    }

    @Test
    @DisplayName("Undiscovered destinations cannot be warped to")
    void testUndiscovered() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        Destination hidden = Destination.undiscovered("hidden", 500.0d, 0.0d, 40.0d);
        FakeTraveler player = new FakeTraveler(0, 0);

        assertFalse(fixture.stateMachine().canCommit(hidden, player, null));
        assertEquals(
                WarpFailureReason.UNDISCOVERED,
                fixture.stateMachine().commit(hidden, player, null).getFailureReason()
        );
    }

    @Test
    @DisplayName("A second commit while warping is rejected and energy is paid once")
    void testAlreadyWarping() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        FakeTraveler player = new FakeTraveler(0, 0);
        assertTrue(fixture.stateMachine().commit(TARGET, player, null).isSuccess());

        CommitResult second = fixture.stateMachine().commit(TARGET, player, null);
        assertEquals(WarpFailureReason.ALREADY_WARPING, second.getFailureReason());
        assertEquals(950.0d, fixture.energy().current(), 1e-9);
        assertFalse(fixture.stateMachine().canCommit(TARGET, player, null));
        assertFalse(fixture.stateMachine().enterSelection());
    }

    @Test
    @DisplayName("Selection mode is entered from idle and commits leave it")
    void testSelectionMode() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        assertTrue(fixture.stateMachine().enterSelection());
        assertEquals(WarpState.SELECTING, fixture.stateMachine().state());
        fixture.stateMachine().exitSelection();
        assertEquals(WarpState.IDLE, fixture.stateMachine().state());

        fixture.stateMachine().enterSelection();
        assertTrue(fixture.stateMachine().commit(TARGET, new FakeTraveler(0, 0), null).isSuccess());
        assertEquals(WarpState.WARPING, fixture.stateMachine().state());
    }

    @Test
    @DisplayName("A failing subscriber is isolated from the warp and from other subscribers")
    void testFailingSubscriber() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        RecordingHooks healthy = new RecordingHooks();
        fixture.stateMachine().subscribe(new WarpPresentationHooks() {
            @Override
            public void onWarpCommitted(WarpCommitted event) {
                throw new IllegalStateException("particle system offline");
            }
        });
        fixture.stateMachine().subscribe(healthy);

        CommitResult result = fixture.stateMachine().commit(TARGET, new FakeTraveler(0, 0), null);
        fixture.runToArrival(0.25d);

        assertTrue(result.isSuccess());
        assertEquals(1, healthy.committed.size());
        assertEquals(1, healthy.arrived.size());

        assertTrue(fixture.stateMachine().unsubscribe(healthy));
        assertFalse(fixture.stateMachine().unsubscribe(healthy));
    }

    @Test
    @DisplayName("Learning uses the context captured at commit, stamped with arrival time")
    void testLearnsFromCapturedContext() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        FakeTraveler player = new FakeTraveler(0, 0).withHealth(10.0d).addDanger(new Danger("mine", 3.0d, 0.0d));
        WarpContext context = WarpContext.of(player, fixture.clock().nowSeconds());

        CommitResult result = fixture.stateMachine().commit(TARGET, player, context);
        player.withHealth(100.0d);
        fixture.runToArrival(0.5d);

        assertTrue(result.isSuccess());
        assertTrue(result.getCost() < 50);
        assertEquals(1, fixture.memory().behavior().emergencyWarps());
        assertEquals(1, fixture.memory().emergencyPatterns().rescueWarps());
        assertEquals(2.0d, fixture.memory().emergencyPatterns().lastEmergencyTime(), 1e-12);
    }

    @Test
    @DisplayName("Negative tick deltas are rejected")
    void testTickValidation() {
        WarpStateMachine machine = WarpFixtures.unlockedFixture().stateMachine();
        assertThrows(IllegalArgumentException.class, () -> machine.tick(-1.0d));
        assertThrows(IllegalArgumentException.class, () -> machine.tick(Double.NaN));
    }
}
