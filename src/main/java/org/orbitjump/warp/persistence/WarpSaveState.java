package org.orbitjump.warp.persistence;

import org.orbitjump.warp.energy.EnergySnapshot;
import org.orbitjump.warp.memory.MemorySnapshot;

import java.util.Objects;

/**
 * Everything the warp drive persists.
 *
 * @param memory learned memory.
 * @param energy energy state, or {@code null} when the save carries none.
 * @param unlocked whether the drive upgrade was bought.
 */
public record WarpSaveState(MemorySnapshot memory, EnergySnapshot energy, boolean unlocked) {
    public WarpSaveState {
        Objects.requireNonNull(memory, "memory");
    }
}
