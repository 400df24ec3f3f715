package org.orbitjump.warp.context;

/**
 * Hazard reported near the player by the game world (asteroid field, hostile, collapsing orbit).
 *
 * @param kind free-form hazard kind, used for logs only.
 * @param x world x coordinate.
 * @param y world y coordinate.
 */
public record Danger(String kind, double x, double y) {
}
