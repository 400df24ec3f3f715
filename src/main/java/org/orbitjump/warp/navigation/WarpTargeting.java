package org.orbitjump.warp.navigation;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.DiscoveryRegistry;
import org.orbitjump.warp.context.PlayerModel;
import org.orbitjump.warp.context.Position;
import org.orbitjump.warp.context.WarpContext;
import org.orbitjump.warp.context.WarpTraveler;
import org.orbitjump.warp.core.CommitResult;
import org.orbitjump.warp.core.WarpState;
import org.orbitjump.warp.core.WarpStateMachine;
import org.orbitjump.warp.cost.WarpCostEngine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Destination picking and selection-mode flow.
 */
@Slf4j
@Accessors(fluent = true)
public final class WarpTargeting {

    private final WarpStateMachine stateMachine;
    private final WarpCostEngine costEngine;
    private final DiscoveryRegistry discovery;
    @Getter
    private final double selectionRadius;

    /** Highlighted destination, or {@code null}. */
    @Getter
    private Destination selected;

    public WarpTargeting(
            WarpStateMachine stateMachine,
            WarpCostEngine costEngine,
            DiscoveryRegistry discovery,
            double selectionRadius
    ) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.costEngine = Objects.requireNonNull(costEngine, "costEngine");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        if (!Double.isFinite(selectionRadius) || selectionRadius < 0.0d) {
            throw new IllegalArgumentException("selectionRadius must be finite and >= 0, got " + selectionRadius);
        }
        this.selectionRadius = selectionRadius;
    }

    /**
     * Finds the discovered destination nearest to a pick point.
     *
     * <p>A candidate must lie strictly within {@code radius} of the point and strictly within
     * {@code destination.radius + radius}. The smallest distance wins; on exact ties the earlier
     * entry wins.</p>
     */
    public Optional<Destination> pickNearest(double worldX, double worldY, List<Destination> destinations, double radius) {
        Objects.requireNonNull(destinations, "destinations");
        Destination best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (Destination destination : destinations) {
            if (destination == null || !discovery.isDiscovered(destination)) {
                continue;
            }
            double distance = Position.distance(worldX, worldY, destination.x(), destination.y());
            if (distance < radius && distance < destination.radius() + radius && distance < bestDistance) {
                best = destination;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Toggles selection mode. Refused while locked or warping.
     *
     * @return true when selection mode is active after the call.
     */
    public boolean toggleSelection() {
        if (stateMachine.state() == WarpState.SELECTING) {
            stateMachine.exitSelection();
            selected = null;
            return false;
        }
        selected = null;
        return stateMachine.enterSelection();
    }

    /**
     * Handles a selection click: picks the nearest destination and commits when affordable.
     *
     * @param worldX click x in world coordinates.
     * @param worldY click y in world coordinates.
     * @param destinations candidate destinations.
     * @param player traveler.
     * @param context current situation, or {@code null} for static pricing.
     * @return outcome of the click.
     */
    public SelectionOutcome selectAndMaybeCommit(
            double worldX,
            double worldY,
            List<Destination> destinations,
            WarpTraveler player,
            WarpContext context
    ) {
        if (stateMachine.state() != WarpState.SELECTING) {
            return SelectionOutcome.notSelecting();
        }
        Optional<Destination> pick = pickNearest(worldX, worldY, destinations, selectionRadius);
        if (pick.isEmpty()) {
            return SelectionOutcome.nothingPicked();
        }
        Destination destination = pick.get();
        if (!stateMachine.canCommit(destination, player, context)) {
            selected = destination;
            return SelectionOutcome.highlighted(destination);
        }
        CommitResult result = stateMachine.commit(destination, player, context);
        selected = null;
        return SelectionOutcome.committed(destination, result);
    }

    /**
     * Lists discovered, affordable destinations within {@code maxRange}, nearest first.
     */
    public List<DestinationInRange> destinationsInRange(
            PlayerModel player,
            List<Destination> destinations,
            double maxRange,
            WarpContext context
    ) {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(destinations, "destinations");
        Position origin = player.position();
        List<DestinationInRange> out = new ArrayList<>();
        for (Destination destination : destinations) {
            if (destination == null || !discovery.isDiscovered(destination)) {
                continue;
            }
            double distance = origin.distanceTo(destination.position());
            if (distance > maxRange) {
                continue;
            }
            int cost = costEngine.quote(distance, origin, destination, context);
            if (costEngine.isAffordable(cost)) {
                out.add(new DestinationInRange(destination, distance, cost));
            }
        }
        out.sort(Comparator.comparingDouble(DestinationInRange::distance));
        return out;
    }

    /**
     * Plans a direct single-hop route.
     */
    public RoutePlan planRoute(Position source, Destination destination, WarpContext context) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        double distance = source.distanceTo(destination.position());
        int cost = costEngine.quote(distance, source, destination, context);
        return new RoutePlan(source, destination, List.of(destination), distance, cost, costEngine.isAffordable(cost));
    }

    /**
     * Clears the highlight and leaves selection mode.
     */
    public void reset() {
        selected = null;
        stateMachine.exitSelection();
        log.debug("targeting reset");
    }
}
