package com.hellblazer.kinetica.simulation.collision;

import com.hellblazer.kinetica.geometry.WorldBounds;
import com.hellblazer.kinetica.simulation.Ship;
import com.hellblazer.kinetica.simulation.entity.LongEntityID;
import com.hellblazer.kinetica.simulation.entity.SequentialLongIDGenerator;
import com.hellblazer.kinetica.simulation.entity.StringEntityID;
import com.hellblazer.kinetica.simulation.fracture.AsteroidFragment;
import com.hellblazer.kinetica.simulation.fracture.SizeTierTable;
import com.hellblazer.kinetica.simulation.kinetics.KineticEntity;
import com.hellblazer.kinetica.simulation.kinetics.KineticProfile;
import com.hellblazer.kinetica.simulation.projectile.Projectile;
import com.hellblazer.kinetica.simulation.projectile.ProjectileConfig;
import com.hellblazer.kinetica.simulation.projectile.ProjectileSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CollisionBroadphase - overlap rule, contact ordering, exclusivity and statistics.
 *
 * @author hal.hildebrand
 */
class CollisionBroadphaseTest {

    private WorldBounds         bounds;
    private CollisionBroadphase broadphase;
    private ProjectileSystem    projectiles;
    private long                nextAsteroid;

    @BeforeEach
    void setUp() {
        bounds = new WorldBounds(160, 144);
        broadphase = new CollisionBroadphase();
        projectiles = new ProjectileSystem(ProjectileConfig.defaults().withCooldownMs(0), bounds,
                                           new SequentialLongIDGenerator());
        nextAsteroid = 1000;
    }

    private AsteroidFragment asteroid(int tier, float x, float y) {
        var kinetics = new KineticEntity(KineticProfile.asteroid(), bounds, new Point2f(x, y), new Vector2f());
        return new AsteroidFragment(new LongEntityID(nextAsteroid++), kinetics, SizeTierTable.defaults().get(tier));
    }

    private Ship ship(String id, float x, float y) {
        var kinetics = new KineticEntity(KineticProfile.ship(), bounds, new Point2f(x, y), new Vector2f());
        return new Ship(new StringEntityID(id), kinetics, 3.0f, null);
    }

    private Projectile shot(float x, float y) {
        var handle = projectiles.fireProjectile("p1", new Point2f(x, y), 0.0f, 0.0).value();
        return projectiles.getProjectile(handle).value();
    }

    @Test
    void testTouchingCountsAsOverlap() {
        assertTrue(CollisionBroadphase.overlaps(new Point2f(0, 0), 2.0f, new Point2f(5, 0), 3.0f));
        assertFalse(CollisionBroadphase.overlaps(new Point2f(0, 0), 2.0f, new Point2f(5.01f, 0), 3.0f));
        assertTrue(CollisionBroadphase.overlaps(ship("a", 10, 10), asteroid(1, 14, 10)));
    }

    @Test
    void testShipHits() {
        var ships = List.of(ship("a", 20, 20), ship("b", 100, 100));
        var near = asteroid(3, 30, 20);
        var far = asteroid(1, 60, 60);

        var hits = broadphase.detectShipHits(ships, List.of(near, far));

        assertEquals(1, hits.size());
        assertEquals(new StringEntityID("a"), hits.get(0).shipId());
        assertEquals(near.getId(), hits.get(0).asteroidId());
        assertEquals(10.0f, hits.get(0).distance(), 1e-5f);
        assertEquals(new CollisionStats(4, 1, 0), broadphase.getLastStats());
    }

    @Test
    void testProjectileHitsInIterationOrder() {
        var first = shot(50, 50);
        var second = shot(90, 90);
        var a = asteroid(3, 52, 50);
        var b = asteroid(3, 91, 90);
        var c = asteroid(2, 50, 53);

        var hits = broadphase.detectProjectileHits(List.of(first, second), List.of(a, b, c));

        assertEquals(3, hits.size());
        assertSame(a, hits.get(0).asteroid());
        assertSame(c, hits.get(1).asteroid());
        assertSame(b, hits.get(2).asteroid());
        assertSame(second, hits.get(2).projectile());
        assertEquals(0.0f, hits.get(0).impactAngle());
    }

    @Test
    void testFirstContactsAreExclusive() {
        var first = shot(50, 50);
        var second = shot(51, 50);
        var a = asteroid(3, 52, 50);
        var b = asteroid(3, 50, 54);

        var hits = broadphase.detectProjectileHits(List.of(first, second), List.of(a, b));
        assertEquals(4, hits.size());

        var exclusive = CollisionBroadphase.firstContacts(hits);
        assertEquals(2, exclusive.size());
        assertSame(first, exclusive.get(0).projectile());
        assertSame(a, exclusive.get(0).asteroid());
        assertSame(second, exclusive.get(1).projectile());
        assertSame(b, exclusive.get(1).asteroid());
    }

    @Test
    void testDistanceIsNotToroidal() {
        var edge = shot(1, 72);
        var across = asteroid(1, 158, 72);
        assertTrue(broadphase.detectProjectileHits(List.of(edge), List.of(across)).isEmpty());
    }

    @Test
    void testStatsAccumulate() {
        var ships = new ArrayList<Ship>();
        ships.add(ship("a", 20, 20));
        var rocks = List.of(asteroid(1, 21, 20), asteroid(1, 120, 120));

        broadphase.detectShipHits(ships, rocks);
        broadphase.detectProjectileHits(List.of(shot(120, 121)), rocks);

        var total = broadphase.getTotalStats();
        assertEquals(4, total.pairsTested());
        assertEquals(1, total.shipHits());
        assertEquals(1, total.projectileHits());
        assertEquals(0.5, total.hitRate(), 1e-9);

        broadphase.resetStats();
        assertEquals(CollisionStats.EMPTY, broadphase.getTotalStats());
        assertEquals(0.0, CollisionStats.EMPTY.hitRate());
    }
}
