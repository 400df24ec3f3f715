package org.orbitjump.warp.memory;

import org.orbitjump.core.id.DestinationId;

/**
 * Debug record of a rejected warp.
 *
 * @param destination destination the player tried to reach.
 * @param reasonCode stable rejection reason code.
 * @param costNeeded quoted price.
 * @param energyAvailable energy at the time of the attempt.
 * @param shortfall {@code max(0, costNeeded - energyAvailable)}.
 * @param time session time of the attempt.
 */
public record FailedAttempt(
        DestinationId destination,
        String reasonCode,
        double costNeeded,
        double energyAvailable,
        double shortfall,
        double time
) {
}
