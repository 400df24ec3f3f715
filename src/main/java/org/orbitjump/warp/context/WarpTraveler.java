package org.orbitjump.warp.context;

/**
 * Player body the warp state machine relocates on arrival.
 */
public interface WarpTraveler extends PlayerModel {

    /**
     * Places the traveler at a world position and cancels any residual velocity.
     *
     * @param x arrival x coordinate.
     * @param y arrival y coordinate.
     */
    void placeAt(double x, double y);
}
