package org.orbitjump.warp.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.Position;
import org.orbitjump.warp.context.WarpContext;

import java.util.Objects;

/**
 * In-flight warp. Transient; never persisted.
 */
@Getter
@Accessors(fluent = true)
public final class WarpAttempt {
    private final Position source;
    private final Destination destination;
    private final int cost;
    private final double startTime;
    private final double distance;
    /** Context captured at commit; {@code null} for a statically priced warp. */
    private final WarpContext context;
    private double progress;

    WarpAttempt(Position source, Destination destination, int cost, double startTime, WarpContext context) {
        this.source = Objects.requireNonNull(source, "source");
        this.destination = Objects.requireNonNull(destination, "destination");
        this.cost = cost;
        this.startTime = startTime;
        this.distance = source.distanceTo(destination.position());
        this.context = context;
    }

    /**
     * Advances progress by {@code delta}, capped at {@code 1}.
     *
     * @return true once the attempt is complete.
     */
    boolean advance(double delta) {
        progress = Math.min(1.0d, progress + delta);
        return progress >= 1.0d;
    }
}
