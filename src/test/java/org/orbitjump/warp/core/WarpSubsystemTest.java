package org.orbitjump.warp.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.orbitjump.warp.config.WarpRuntimeConfig;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.memory.MemoryStats;
import org.orbitjump.warp.persistence.InMemoryKeyValueStore;
import org.orbitjump.warp.persistence.KeyValueStore;
import org.orbitjump.warp.persistence.WarpPersistence;
import org.orbitjump.warp.testutil.FakeTraveler;
import org.orbitjump.warp.testutil.RecordingHooks;
import org.orbitjump.warp.testutil.WarpFixtures;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WarpSubsystem Tests")
class WarpSubsystemTest {

    private static final Destination ALPHA = WarpFixtures.planet("alpha", 3000.0d, 0.0d);
    private static final Destination BETA = WarpFixtures.planet("beta", 0.0d, 0.0d);

    private static WarpSubsystem unlocked(FakeTraveler player, KeyValueStore store) {
        return WarpSubsystem.builder()
                .config(WarpRuntimeConfig.builder().startUnlocked(true).build())
                .player(player)
                .store(store)
                .build();
    }

    private static void settle(WarpSubsystem warp) {
        int guard = 0;
        do {
            warp.update(0.1d);
        } while (warp.status().getState() != WarpState.IDLE && ++guard < 1_000);
    }

    @Test
    @DisplayName("Builder falls back to defaults and starts locked")
    void testBuilderDefaults() {
        WarpSubsystem warp = WarpSubsystem.builder().player(new FakeTraveler(0, 0)).build();

        WarpStatus status = warp.status();
        assertFalse(status.isUnlocked());
        assertEquals(WarpState.IDLE, status.getState());
        assertEquals(1000.0d, status.getEnergy().getCurrent());
        assertNull(status.getTarget());
        assertEquals(WarpRuntimeConfig.defaults(), warp.config());
        assertThrows(NullPointerException.class, () -> WarpSubsystem.builder().build());
    }

    @Test
    @DisplayName("Regeneration runs before commits issued later in the same frame")
    void testFrameOrder() {
        WarpSubsystem warp = unlocked(new FakeTraveler(0, 0), null);
        warp.energy().consume(965.0d);
        int quote = warp.quote(ALPHA);
        assertTrue(quote > warp.energy().current());

        warp.update(0.5d);

        assertTrue(warp.canCommit(ALPHA));
        assertTrue(warp.commit(ALPHA).isSuccess());
        assertEquals(0.5d, warp.clock().nowSeconds(), 1e-12);
    }

    @Test
    @DisplayName("Status follows a warp from commit to idle")
    void testStatus() {
        RecordingHooks hooks = new RecordingHooks();
        FakeTraveler player = new FakeTraveler(0, 0);
        WarpSubsystem warp = WarpSubsystem.builder()
                .config(WarpRuntimeConfig.builder().startUnlocked(true).build())
                .player(player)
                .hook(hooks)
                .build();

        warp.commit(ALPHA);
        warp.update(1.0d);
        WarpStatus mid = warp.status();
        assertEquals(WarpState.WARPING, mid.getState());
        assertEquals(ALPHA, mid.getTarget());
        assertEquals(0.5d, mid.getProgress(), 1e-12);
        assertTrue(mid.getEnergy().isRegenerationSuspended());

        settle(warp);
        assertEquals(1, hooks.arrived.size());
        assertEquals(3070.0d, player.x(), 1e-9);
        assertEquals(1, warp.memoryStats().getTotalWarps());
    }

    @Test
    @DisplayName("Selection flow highlights and commits through the subsystem")
    void testSelectionFlow() {
        WarpSubsystem warp = unlocked(new FakeTraveler(0, 0), null);
        assertTrue(warp.toggleSelection());
        assertEquals(WarpState.SELECTING, warp.status().getState());

        warp.selectAt(3005.0d, 0.0d, List.of(ALPHA, BETA));
        assertEquals(WarpState.WARPING, warp.status().getState());
        assertNull(warp.status().getSelected());
        assertEquals(1, warp.planRoute(BETA).hops().size());
        assertTrue(warp.destinationsInRange(List.of(ALPHA, BETA), 10_000.0d).size() >= 1);
    }

    @Test
    @DisplayName("Learned state survives save and load into a fresh subsystem")
    void testSaveLoadRoundTrip() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        FakeTraveler player = new FakeTraveler(0, 0);
        WarpSubsystem first = unlocked(player, store);
        for (int i = 0; i < 4; i++) {
            first.commit(i % 2 == 0 ? ALPHA : BETA);
            settle(first);
            for (int f = 0; f < 100; f++) {
                first.update(0.1d);
            }
        }
        first.energy().consume(300.0d);
        assertTrue(first.save());

        WarpSubsystem second = WarpSubsystem.builder().player(new FakeTraveler(0, 0)).store(store).build();
        assertTrue(second.load());

        MemoryStats before = first.memoryStats();
        MemoryStats after = second.memoryStats();
        assertEquals(before.getTotalWarps(), after.getTotalWarps());
        assertEquals(before.getKnownRoutes(), after.getKnownRoutes());
        assertEquals(before.getKnownDestinations(), after.getKnownDestinations());
        assertEquals(before.getSkillLevel(), after.getSkillLevel(), 1e-12);
        assertEquals(
                first.memory().affinity(ALPHA.id()).orElseThrow().affinity(),
                second.memory().affinity(ALPHA.id()).orElseThrow().affinity(),
                1e-12
        );
        assertEquals(first.energy().current(), second.energy().current(), 1e-9);
        assertTrue(second.status().isUnlocked());
        assertEquals(first.quote(ALPHA), second.quote(ALPHA));
    }

    @Test
    @DisplayName("Corrupt save resets memory learned this session")
    void testCorruptLoad() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        WarpSubsystem warp = unlocked(new FakeTraveler(0, 0), store);
        warp.commit(ALPHA);
        settle(warp);
        assertEquals(1, warp.memoryStats().getTotalWarps());
        store.put(WarpPersistence.STORAGE_KEY, "not json at all {");

        assertFalse(warp.load());
        assertEquals(0, warp.memoryStats().getTotalWarps());
        assertTrue(warp.status().isUnlocked());
    }

    @Test
    @DisplayName("Loading with nothing stored keeps memory learned this session")
    void testLoadWithoutSaveKeepsMemory() {
        WarpSubsystem warp = unlocked(new FakeTraveler(0, 0), new InMemoryKeyValueStore());
        warp.commit(ALPHA);
        settle(warp);
        double energyBefore = warp.energy().current();

        assertFalse(warp.load());
        assertAll(
                () -> assertEquals(1, warp.memoryStats().getTotalWarps()),
                () -> assertEquals(1, warp.memoryStats().getKnownRoutes()),
                () -> assertEquals(energyBefore, warp.energy().current()),
                () -> assertTrue(warp.status().isUnlocked())
        );
    }

    @Test
    @DisplayName("Store failures are logged and never thrown")
    void testFailingStore() {
        KeyValueStore broken = new KeyValueStore() {
            @Override
            public Optional<String> get(String key) {
                throw new IllegalStateException("disk gone");
            }

            @Override
            public void put(String key, String value) {
                throw new IllegalStateException("disk gone");
            }
        };
        WarpSubsystem warp = unlocked(new FakeTraveler(0, 0), broken);

        assertFalse(warp.save());
        assertFalse(warp.load());
    }

    @Test
    @DisplayName("Unlock through the subsystem reaches subscribers")
    void testUnlock() {
        RecordingHooks hooks = new RecordingHooks();
        WarpSubsystem warp = WarpSubsystem.builder().player(new FakeTraveler(0, 0)).build();
        warp.subscribe(hooks);

        assertEquals(WarpFailureReason.LOCKED, warp.commit(ALPHA).getFailureReason());
        warp.unlock();

        assertEquals(1, hooks.unlocks);
        assertTrue(warp.commit(ALPHA).isSuccess());
    }
}
