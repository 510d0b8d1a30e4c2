package com.hellblazer.kinetica.simulation.collision;

import com.hellblazer.kinetica.geometry.DeterministicMath;
import com.hellblazer.kinetica.simulation.Ship;
import com.hellblazer.kinetica.simulation.entity.EntityID;
import com.hellblazer.kinetica.simulation.fracture.AsteroidFragment;
import com.hellblazer.kinetica.simulation.projectile.Projectile;

import javax.vecmath.Point2f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pairwise circle-circle overlap tests between ships, shots and asteroids.
 * <p>
 * Contacts are reported in a stable order: outer collection first, then inner, both in iteration order. Detection
 * has no side effects on the bodies; resolution belongs to the caller.
 *
 * @author hal.hildebrand
 */
public class CollisionBroadphase {

    private CollisionStats lastStats  = CollisionStats.EMPTY;
    private CollisionStats totalStats = CollisionStats.EMPTY;

    /**
     * Two circles overlap when their center distance is at most the sum of the radii. Touching counts.
     */
    public static boolean overlaps(Point2f a, float radiusA, Point2f b, float radiusB) {
        return DeterministicMath.distance(a, b) <= radiusA + radiusB;
    }

    public static boolean overlaps(Collidable a, Collidable b) {
        return overlaps(a.getPosition(), a.getRadius(), b.getPosition(), b.getRadius());
    }

    /**
     * Keep only the first contact of each shot and of each asteroid, so one shot destroys at most one asteroid and
     * one asteroid is destroyed at most once.
     */
    public static List<ProjectileHit> firstContacts(List<ProjectileHit> hits) {
        Set<EntityID> shots = new HashSet<>();
        Set<EntityID> struck = new HashSet<>();
        List<ProjectileHit> exclusive = new ArrayList<>();
        for (var hit : hits) {
            if (shots.contains(hit.projectile().getId()) || struck.contains(hit.asteroid().getId())) {
                continue;
            }
            shots.add(hit.projectile().getId());
            struck.add(hit.asteroid().getId());
            exclusive.add(hit);
        }
        return exclusive;
    }

    /**
     * Every ship-asteroid overlap.
     */
    public List<ShipHit> detectShipHits(Collection<Ship> ships, Collection<AsteroidFragment> asteroids) {
        long tested = 0;
        List<ShipHit> hits = new ArrayList<>();
        for (var ship : ships) {
            var p = ship.getPosition();
            for (var asteroid : asteroids) {
                tested++;
                float distance = DeterministicMath.distance(p, asteroid.getPosition());
                if (distance <= ship.getRadius() + asteroid.getRadius()) {
                    hits.add(new ShipHit(ship, asteroid, distance));
                }
            }
        }
        record(new CollisionStats(tested, hits.size(), 0));
        return hits;
    }

    /**
     * Every shot-asteroid overlap.
     */
    public List<ProjectileHit> detectProjectileHits(Collection<Projectile> projectiles,
                                                    Collection<AsteroidFragment> asteroids) {
        long tested = 0;
        List<ProjectileHit> hits = new ArrayList<>();
        for (var projectile : projectiles) {
            var p = projectile.getPosition();
            for (var asteroid : asteroids) {
                tested++;
                float distance = DeterministicMath.distance(p, asteroid.getPosition());
                if (distance <= projectile.getRadius() + asteroid.getRadius()) {
                    hits.add(new ProjectileHit(projectile, asteroid, distance));
                }
            }
        }
        record(new CollisionStats(tested, 0, hits.size()));
        return hits;
    }

    /**
     * Counters of the most recent detection call.
     */
    public CollisionStats getLastStats() {
        return lastStats;
    }

    /**
     * Counters accumulated since construction or {@link #resetStats()}.
     */
    public CollisionStats getTotalStats() {
        return totalStats;
    }

    public void resetStats() {
        lastStats = CollisionStats.EMPTY;
        totalStats = CollisionStats.EMPTY;
    }

    private void record(CollisionStats stats) {
        lastStats = stats;
        totalStats = totalStats.plus(stats);
    }
}
