package com.hellblazer.kinetica.simulation;

/**
 * Kinds of body in a {@link FrameSnapshot}.
 */
public enum EntityKind {
    SHIP, ASTEROID, PROJECTILE
}
