package org.orbitjump.warp.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Objects;

/**
 * Situation the player is in when a warp is priced or learned from.
 *
 * <p>Contexts are immutable snapshots. The learning path re-stamps the commit-time context
 * with the arrival time via {@link #withNowSeconds(double)}.</p>
 */
@Value
@Builder
@Accessors(fluent = true)
public class WarpContext {
    /** Player health in {@code [0, 100]}. */
    @Builder.Default
    double health = PlayerModel.MAX_HEALTH;
    /** Hazards near the player. */
    @Singular
    List<Danger> nearbyDangers;
    /** Session time the context was taken at. */
    @With
    double nowSeconds;

    /**
     * Captures the context of {@code player} at session time {@code nowSeconds}.
     */
    public static WarpContext of(PlayerModel player, double nowSeconds) {
        Objects.requireNonNull(player, "player");
        List<Danger> dangers = player.nearbyDangers();
        return WarpContext.builder()
                .health(player.health())
                .nearbyDangers(dangers == null ? List.of() : dangers)
                .nowSeconds(nowSeconds)
                .build();
    }

    /**
     * Healthy, hazard-free context at session time {@code nowSeconds}.
     */
    public static WarpContext calm(double nowSeconds) {
        return WarpContext.builder().nowSeconds(nowSeconds).build();
    }

    /**
     * Returns whether any hazard is near the player.
     */
    public boolean hasNearbyDanger() {
        return !nearbyDangers.isEmpty();
    }
}
