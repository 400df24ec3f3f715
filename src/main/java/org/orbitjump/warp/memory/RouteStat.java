package org.orbitjump.warp.memory;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Usage statistics of one route. Created on first use, evicted only by consolidation.
 */
@Getter
@Accessors(fluent = true)
public final class RouteStat {
    private int uses;
    private double totalCostPaid;

    RouteStat() {
    }

    RouteStat(int uses, double totalCostPaid) {
        this.uses = uses;
        this.totalCostPaid = totalCostPaid;
    }

    /**
     * Mean price paid on this route; {@code 0} before the first use.
     */
    public double averageCost() {
        return uses == 0 ? 0.0d : totalCostPaid / uses;
    }

    void record(double cost) {
        uses++;
        totalCostPaid += cost;
    }
}
