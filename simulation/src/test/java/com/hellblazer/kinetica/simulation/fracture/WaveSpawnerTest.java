package com.hellblazer.kinetica.simulation.fracture;

import com.hellblazer.kinetica.geometry.DeterministicMath;
import com.hellblazer.kinetica.geometry.WorldBounds;
import com.hellblazer.kinetica.simulation.entity.SequentialLongIDGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2f;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class WaveSpawnerTest {

    private WaveSpawner spawner;
    private Random      random;

    @BeforeEach
    void setUp() {
        var fracture = new FractureSystem(SizeTierTable.defaults(), FractureConfig.defaults(),
                                          new WorldBounds(160, 144), new SequentialLongIDGenerator());
        spawner = new WaveSpawner(fracture);
        random = new Random(11);
    }

    @Test
    void testWavesGrow() {
        assertEquals(0, spawner.getCurrentWave());
        assertFalse(spawner.isWaveActive());

        var first = spawner.startNextWave(null, random);
        assertEquals(1, first.number());
        assertEquals(4, first.asteroids().size());
        assertTrue(spawner.isWaveActive());

        var second = spawner.startNextWave(null, random);
        assertEquals(2, second.number());
        assertEquals(6, second.asteroids().size());
        assertEquals(0, spawner.getWavesCompleted(), "abandoning a wave does not complete it");
    }

    @Test
    void testClearedExactlyOnce() {
        spawner.startNextWave(null, random);

        assertFalse(spawner.update(0.5, 3));
        assertFalse(spawner.update(0.5, 1));
        assertEquals(1.0, spawner.getWaveElapsed(), 1e-9);

        assertTrue(spawner.update(0.5, 0));
        assertFalse(spawner.isWaveActive());
        assertEquals(1, spawner.getWavesCompleted());

        assertFalse(spawner.update(0.5, 0), "an inactive wave cannot clear again");
        assertEquals(1, spawner.getWavesCompleted());
    }

    @Test
    void testSafeHaven() {
        var player = new Point2f(80, 72);
        var zone = spawner.safeZoneAround(player);
        assertEquals(WaveSpawner.DEFAULT_SAFE_HAVEN_RADIUS, zone.radius());

        var wave = spawner.startNextWave(zone, random);
        for (var asteroid : wave.asteroids()) {
            assertTrue(DeterministicMath.distance(asteroid.getPosition(), player) > 40.0f);
        }
    }

    @Test
    void testReset() {
        spawner.startNextWave(null, random);
        spawner.update(1.0, 0);
        spawner.reset();

        assertEquals(0, spawner.getCurrentWave());
        assertEquals(0, spawner.getWavesCompleted());
        assertEquals(1, spawner.startNextWave(null, random).number());
    }
}
