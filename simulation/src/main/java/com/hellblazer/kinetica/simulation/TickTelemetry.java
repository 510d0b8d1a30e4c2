package com.hellblazer.kinetica.simulation;

import com.hellblazer.kinetica.simulation.collision.CollisionStats;

/**
 * What happened during one tick.
 *
 * @param tick                tick number, starting at 1
 * @param ships               ships on the field
 * @param asteroids           asteroids on the field after collision resolution
 * @param activeProjectiles   shots in flight
 * @param pooledProjectiles   free pool slots
 * @param projectilesExpired  shots recycled by lifetime
 * @param shipHits            ship-asteroid contacts
 * @param asteroidsDestroyed  asteroids removed by shots
 * @param fragmentsSpawned    fragments that replaced them
 * @param collisions          broad-phase counters of this tick
 */
public record TickTelemetry(long tick, int ships, int asteroids, int activeProjectiles, int pooledProjectiles,
                            int projectilesExpired, int shipHits, int asteroidsDestroyed, int fragmentsSpawned,
                            CollisionStats collisions) {

    public static final TickTelemetry NONE = new TickTelemetry(0, 0, 0, 0, 0, 0, 0, 0, 0, CollisionStats.EMPTY);
}
