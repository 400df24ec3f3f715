package org.orbitjump.warp.memory;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Visit statistics of one destination.
 *
 * <p>{@code affinity} is this destination's share of all destination visits and is
 * renormalized for every destination whenever any visit is recorded.</p>
 */
@Getter
@Accessors(fluent = true)
public final class PlanetAffinity {
    private int visits;
    private double lastVisitTime;
    private double affinity;

    PlanetAffinity() {
    }

    PlanetAffinity(int visits, double lastVisitTime) {
        this.visits = visits;
        this.lastVisitTime = lastVisitTime;
    }

    void visit(double now) {
        visits++;
        lastVisitTime = now;
    }

    void renormalize(long totalVisits) {
        affinity = totalVisits <= 0 ? 0.0d : (double) visits / totalVisits;
    }
}
