package org.orbitjump.warp.navigation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.orbitjump.warp.config.WarpRuntimeConfig;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.DiscoveryRegistry;
import org.orbitjump.warp.context.WarpContext;
import org.orbitjump.warp.core.WarpState;
import org.orbitjump.warp.testutil.FakeTraveler;
import org.orbitjump.warp.testutil.WarpFixtures;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.orbitjump.warp.testutil.WarpFixtures.ORIGIN;

@DisplayName("WarpTargeting Tests")
class WarpTargetingTest {

    private static WarpTargeting targeting(WarpFixtures.Fixture fixture) {
        return new WarpTargeting(
                fixture.stateMachine(),
                fixture.costEngine(),
                DiscoveryRegistry.fromDestinationFlags(),
                fixture.config().getSelectionRadius()
        );
    }

    @Test
    @DisplayName("Nearest discovered destination wins and earlier entries win ties")
    void testPickNearest() {
        WarpTargeting targeting = targeting(WarpFixtures.unlockedFixture());
        Destination east = Destination.discovered("east", 30.0d, 0.0d, 40.0d);
        Destination north = Destination.discovered("north", 0.0d, 30.0d, 40.0d);
        Destination hidden = Destination.undiscovered("hidden", 10.0d, 0.0d, 40.0d);

        assertEquals(Optional.of(east), targeting.pickNearest(0, 0, List.of(hidden, east, north), 50.0d));
        assertEquals(Optional.of(north), targeting.pickNearest(0, 0, List.of(hidden, north, east), 50.0d));
        assertEquals(Optional.of(north), targeting.pickNearest(0, 20, List.of(east, north), 50.0d));
    }

    @Test
    @DisplayName("Pick radius is strict")
    void testPickRadiusIsStrict() {
        WarpTargeting targeting = targeting(WarpFixtures.unlockedFixture());
        Destination edge = Destination.discovered("edge", 50.0d, 0.0d, 40.0d);
        Destination dot = Destination.discovered("dot", 0.0d, 20.0d, 0.0d);

        assertTrue(targeting.pickNearest(0, 0, List.of(edge), 50.0d).isEmpty());
        assertEquals(Optional.of(dot), targeting.pickNearest(0, 0, List.of(edge, dot), 50.0d));
        assertTrue(targeting.pickNearest(0, 0, List.of(), 50.0d).isEmpty());
    }

    @Test
    @DisplayName("Selection toggles only while unlocked and not warping")
    void testToggleSelection() {
        WarpFixtures.Fixture locked = WarpFixtures.createFixture(WarpRuntimeConfig.defaults());
        assertFalse(targeting(locked).toggleSelection());
        assertEquals(WarpState.IDLE, locked.stateMachine().state());

        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        WarpTargeting targeting = targeting(fixture);
        assertTrue(targeting.toggleSelection());
        assertEquals(WarpState.SELECTING, fixture.stateMachine().state());
        assertFalse(targeting.toggleSelection());
        assertEquals(WarpState.IDLE, fixture.stateMachine().state());

        fixture.stateMachine().commit(WarpFixtures.planet("p", 500.0d, 0.0d), new FakeTraveler(0, 0), null);
        assertFalse(targeting.toggleSelection());
        assertEquals(WarpState.WARPING, fixture.stateMachine().state());
    }

    @Test
    @DisplayName("Affordable pick commits immediately and leaves selection mode")
    void testSelectCommits() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        WarpTargeting targeting = targeting(fixture);
        Destination planet = WarpFixtures.planet("p", 3000.0d, 0.0d);
        FakeTraveler player = new FakeTraveler(0, 0);

        assertEquals(
                SelectionOutcome.Kind.NOT_SELECTING,
                targeting.selectAndMaybeCommit(3000, 0, List.of(planet), player, null).kind()
        );

        targeting.toggleSelection();
        assertEquals(
                SelectionOutcome.Kind.NOTHING_PICKED,
                targeting.selectAndMaybeCommit(0, 0, List.of(planet), player, null).kind()
        );

        SelectionOutcome outcome = targeting.selectAndMaybeCommit(3010, 5, List.of(planet), player, null);
        assertEquals(SelectionOutcome.Kind.COMMITTED, outcome.kind());
        assertTrue(outcome.commit().isSuccess());
        assertEquals(planet, outcome.picked());
        assertNull(targeting.selected());
        assertEquals(WarpState.WARPING, fixture.stateMachine().state());
    }

    @Test
    @DisplayName("Unaffordable pick stays highlighted in selection mode")
    void testSelectHighlights() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        WarpTargeting targeting = targeting(fixture);
        Destination planet = WarpFixtures.planet("p", 3000.0d, 0.0d);
        fixture.energy().consume(990.0d);

        targeting.toggleSelection();
        SelectionOutcome outcome = targeting.selectAndMaybeCommit(3000, 0, List.of(planet), new FakeTraveler(0, 0), null);

        assertEquals(SelectionOutcome.Kind.HIGHLIGHTED, outcome.kind());
        assertNull(outcome.commit());
        assertEquals(planet, targeting.selected());
        assertEquals(WarpState.SELECTING, fixture.stateMachine().state());
        assertEquals(0L, fixture.memory().failedAttemptCount());

        targeting.reset();
        assertNull(targeting.selected());
        assertEquals(WarpState.IDLE, fixture.stateMachine().state());
    }

    @Test
    @DisplayName("Destinations in range are discovered, affordable and sorted by distance")
    void testDestinationsInRange() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        WarpTargeting targeting = targeting(fixture);
        Destination mid = WarpFixtures.planet("mid", 3000.0d, 0.0d);
        Destination near = WarpFixtures.planet("near", 0.0d, 1000.0d);
        Destination pricey = WarpFixtures.planet("pricey", 12_000.0d, 0.0d);
        Destination outside = WarpFixtures.planet("outside", 20_000.0d, 0.0d);
        Destination hidden = Destination.undiscovered("hidden", 500.0d, 0.0d, 40.0d);
        fixture.energy().consume(920.0d);

        List<DestinationInRange> reachable = targeting.destinationsInRange(
                new FakeTraveler(0, 0),
                List.of(mid, pricey, outside, hidden, near),
                15_000.0d,
                WarpContext.calm(0.0d)
        );

        assertEquals(2, reachable.size());
        assertEquals(near, reachable.get(0).destination());
        assertEquals(1000.0d, reachable.get(0).distance(), 1e-9);
        assertEquals(42, reachable.get(0).cost());
        assertEquals(mid, reachable.get(1).destination());
    }

    @Test
    @DisplayName("Route plans are a single direct hop")
    void testPlanRoute() {
        WarpFixtures.Fixture fixture = WarpFixtures.unlockedFixture();
        WarpTargeting targeting = targeting(fixture);
        Destination planet = WarpFixtures.planet("p", 6000.0d, 8000.0d);

        RoutePlan plan = targeting.planRoute(ORIGIN, planet, null);

        assertEquals(List.of(planet), plan.hops());
        assertEquals(10_000.0d, plan.distance(), 1e-9);
        assertEquals(100, plan.cost());
        assertTrue(plan.affordable());
    }
}
