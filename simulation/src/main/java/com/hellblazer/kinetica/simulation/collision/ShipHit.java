package com.hellblazer.kinetica.simulation.collision;

import com.hellblazer.kinetica.simulation.Ship;
import com.hellblazer.kinetica.simulation.entity.LongEntityID;
import com.hellblazer.kinetica.simulation.entity.StringEntityID;
import com.hellblazer.kinetica.simulation.fracture.AsteroidFragment;

/**
 * A ship overlapping an asteroid. What the hit means is up to the listener.
 *
 * @param ship     the ship
 * @param asteroid the asteroid it touches
 * @param distance center distance at detection
 */
public record ShipHit(Ship ship, AsteroidFragment asteroid, float distance) {

    public StringEntityID shipId() {
        return ship.getId();
    }

    public LongEntityID asteroidId() {
        return asteroid.getId();
    }
}
