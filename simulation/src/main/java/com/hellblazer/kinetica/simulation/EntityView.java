package com.hellblazer.kinetica.simulation;

import com.hellblazer.kinetica.simulation.entity.EntityID;

/**
 * Immutable copy of one body's state, for renderers.
 *
 * @param id      body id
 * @param kind    body kind
 * @param x       position x
 * @param y       position y
 * @param heading heading in radians
 * @param radius  collision radius
 * @param tier    size tier for asteroids, zero otherwise
 */
public record EntityView(EntityID id, EntityKind kind, float x, float y, float heading, float radius, int tier) {
}
