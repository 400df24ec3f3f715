package org.orbitjump.warp.navigation;

import org.orbitjump.warp.context.Destination;

/**
 * Reachable destination with its live quote.
 *
 * @param destination reachable destination.
 * @param distance center-to-center distance from the player.
 * @param cost current quote.
 */
public record DestinationInRange(Destination destination, double distance, int cost) {
}
