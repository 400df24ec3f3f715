package org.orbitjump.warp.navigation;

import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.Position;

import java.util.List;

/**
 * Planned warp route. Routes are always a single direct hop.
 *
 * @param source start position.
 * @param destination final destination.
 * @param hops destinations visited in order.
 * @param distance total travel distance.
 * @param cost total quoted price.
 * @param affordable whether current energy covers the price.
 */
public record RoutePlan(
        Position source,
        Destination destination,
        List<Destination> hops,
        double distance,
        int cost,
        boolean affordable
) {
    public RoutePlan {
        hops = List.copyOf(hops);
    }
}
