package org.orbitjump.warp.hooks;

import org.orbitjump.warp.context.Destination;

/**
 * Payload of a committed warp.
 *
 * @param destination warp target.
 * @param cost energy paid.
 * @param soundPitch warp sound pitch, rising with cost.
 * @param particleCount tunnel particle burst size, rising with cost.
 */
public record WarpCommitted(Destination destination, int cost, double soundPitch, int particleCount) {

    private static final double BASE_PITCH = 0.8d;
    private static final double PITCH_RANGE = 0.4d;
    private static final double PITCH_COST_SCALE = 500.0d;
    private static final int BASE_PARTICLES = 20;
    private static final int COST_PER_PARTICLE = 10;

    /**
     * Derives presentation parameters from the paid cost.
     */
    public static WarpCommitted of(Destination destination, int cost) {
        double pitch = BASE_PITCH + (cost / PITCH_COST_SCALE) * PITCH_RANGE;
        int particles = BASE_PARTICLES + Math.floorDiv(cost, COST_PER_PARTICLE);
        return new WarpCommitted(destination, cost, pitch, particles);
    }
}
