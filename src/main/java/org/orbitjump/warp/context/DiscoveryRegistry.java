package org.orbitjump.warp.context;

/**
 * Read-only discovery lookup.
 *
 * <p>The default registry trusts the {@link Destination#discovered()} flag. Games that track
 * discovery elsewhere (a save-backed registry, a cheat console) supply their own.</p>
 */
@FunctionalInterface
public interface DiscoveryRegistry {

    /**
     * Returns whether the player may warp to {@code destination}.
     */
    boolean isDiscovered(Destination destination);

    /**
     * Returns the registry that reads the destination's own flag.
     */
    static DiscoveryRegistry fromDestinationFlags() {
        return Destination::discovered;
    }
}
