package org.orbitjump.warp.memory;

/**
 * One learning-curve observation.
 *
 * @param time session time of the warp.
 * @param cost price paid.
 * @param optimal whether the warp was judged cost-efficient.
 */
public record LearningSample(double time, double cost, boolean optimal) {
}
