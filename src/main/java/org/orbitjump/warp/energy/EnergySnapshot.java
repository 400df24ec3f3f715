package org.orbitjump.warp.energy;

/**
 * Persistable energy state.
 *
 * @param current stored energy.
 * @param max capacity.
 * @param regenPerSecond regeneration rate.
 */
public record EnergySnapshot(double current, double max, double regenPerSecond) {
}
