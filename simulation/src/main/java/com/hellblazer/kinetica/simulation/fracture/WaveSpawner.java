package com.hellblazer.kinetica.simulation.fracture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2f;
import java.util.Objects;
import java.util.Random;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.requireNonNegative;

/**
 * Wave progression on top of a {@link FractureSystem}. Tracks which wave is running and when it is cleared; the
 * spawned asteroids belong to the caller.
 *
 * @author hal.hildebrand
 */
public class WaveSpawner {

    /**
     * Radius kept clear around the player when a wave spawns.
     */
    public static final float DEFAULT_SAFE_HAVEN_RADIUS = 40.0f;

    private static final Logger log = LoggerFactory.getLogger(WaveSpawner.class);

    private final FractureSystem fracture;
    private final float          safeHavenRadius;

    private int     currentWave;
    private boolean waveActive;
    private double  waveElapsed;
    private int     wavesCompleted;

    public WaveSpawner(FractureSystem fracture) {
        this(fracture, DEFAULT_SAFE_HAVEN_RADIUS);
    }

    public WaveSpawner(FractureSystem fracture, float safeHavenRadius) {
        this.fracture = Objects.requireNonNull(fracture, "fracture cannot be null");
        this.safeHavenRadius = requireNonNegative(safeHavenRadius, "safeHavenRadius");
    }

    /**
     * Advance to the next wave and spawn it, clear of {@code safeZone} when one is given. A wave still in progress
     * is abandoned.
     */
    public Wave startNextWave(SafeZone safeZone, Random random) {
        if (waveActive) {
            log.debug("Wave {} abandoned after {}s", currentWave, waveElapsed);
        }
        currentWave++;
        var parameters = fracture.calculateWaveDifficulty(currentWave);
        var asteroids = fracture.createWave(parameters, safeZone, random);
        waveActive = true;
        waveElapsed = 0.0;
        return new Wave(parameters, asteroids);
    }

    /**
     * Safe zone of the default radius around {@code player}.
     */
    public SafeZone safeZoneAround(Point2f player) {
        return new SafeZone(player, safeHavenRadius);
    }

    /**
     * Track the running wave.
     *
     * @param remaining destructible bodies still on the field
     * @return true exactly once per wave, on the update that finds the field clear
     */
    public boolean update(double dt, int remaining) {
        if (!waveActive) {
            return false;
        }
        waveElapsed += dt;
        if (remaining > 0) {
            return false;
        }
        waveActive = false;
        wavesCompleted++;
        log.info("Wave {} cleared in {}s", currentWave, String.format("%.2f", waveElapsed));
        return true;
    }

    public void reset() {
        currentWave = 0;
        waveActive = false;
        waveElapsed = 0.0;
        wavesCompleted = 0;
    }

    public int getCurrentWave() {
        return currentWave;
    }

    public boolean isWaveActive() {
        return waveActive;
    }

    public double getWaveElapsed() {
        return waveElapsed;
    }

    public int getWavesCompleted() {
        return wavesCompleted;
    }

    public float getSafeHavenRadius() {
        return safeHavenRadius;
    }
}
