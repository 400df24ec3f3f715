package org.orbitjump.warp.core;

import lombok.Builder;
import lombok.Value;
import org.orbitjump.warp.context.Destination;

/**
 * Outcome of a warp commit. Rejections are values, not exceptions.
 */
@Value
@Builder
public class CommitResult {
    /** Target of the attempt. */
    Destination destination;
    /** Quoted price. */
    int cost;
    /** Energy before the attempt. */
    double energyBefore;
    /** Energy after the attempt; equal to {@link #energyBefore} on rejection. */
    double energyAfter;
    /** Rejection reason; {@code null} on success. */
    WarpFailureReason failureReason;

    /**
     * Returns whether the warp was committed.
     */
    public boolean isSuccess() {
        return failureReason == null;
    }

    static CommitResult accepted(Destination destination, int cost, double before, double after) {
        return CommitResult.builder()
                .destination(destination)
                .cost(cost)
                .energyBefore(before)
                .energyAfter(after)
                .build();
    }

    static CommitResult rejected(Destination destination, int cost, double energy, WarpFailureReason reason) {
        return CommitResult.builder()
                .destination(destination)
                .cost(cost)
                .energyBefore(energy)
                .energyAfter(energy)
                .failureReason(reason)
                .build();
    }
}
