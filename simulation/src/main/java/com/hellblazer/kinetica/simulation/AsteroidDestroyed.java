package com.hellblazer.kinetica.simulation;

import com.hellblazer.kinetica.simulation.entity.LongEntityID;

import java.util.List;

/**
 * A shot destroyed an asteroid. Scoring collaborators credit {@code points} to {@code ownerId}.
 *
 * @param tick             tick of the hit
 * @param asteroidId       destroyed body
 * @param tier             its size tier
 * @param points           its point value
 * @param ownerId          owner of the shot
 * @param projectileHandle the shot, already recycled
 * @param fragmentIds      fragments that replaced it, empty at the terminal tier
 */
public record AsteroidDestroyed(long tick, LongEntityID asteroidId, int tier, int points, String ownerId,
                                LongEntityID projectileHandle, List<LongEntityID> fragmentIds) {

    public AsteroidDestroyed {
        fragmentIds = List.copyOf(fragmentIds);
    }
}
