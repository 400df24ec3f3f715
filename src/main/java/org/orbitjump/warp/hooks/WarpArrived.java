package org.orbitjump.warp.hooks;

import org.orbitjump.warp.context.Destination;

/**
 * Payload of a completed warp.
 *
 * @param destination warp target.
 * @param costPaid energy paid at commit.
 * @param arrivalX arrival x coordinate.
 * @param arrivalY arrival y coordinate.
 * @param shakeIntensity camera shake intensity.
 * @param shakeSeconds camera shake length.
 */
public record WarpArrived(
        Destination destination,
        int costPaid,
        double arrivalX,
        double arrivalY,
        double shakeIntensity,
        double shakeSeconds
) {
    public static final double ARRIVAL_SHAKE_INTENSITY = 15.0d;
    public static final double ARRIVAL_SHAKE_SECONDS = 0.3d;

    /**
     * Creates an arrival payload with the standard camera shake.
     */
    public static WarpArrived of(Destination destination, int costPaid, double arrivalX, double arrivalY) {
        return new WarpArrived(destination, costPaid, arrivalX, arrivalY, ARRIVAL_SHAKE_INTENSITY, ARRIVAL_SHAKE_SECONDS);
    }
}
