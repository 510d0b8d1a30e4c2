package com.hellblazer.kinetica.simulation;

import com.hellblazer.kinetica.geometry.WorldBounds;
import com.hellblazer.kinetica.simulation.fracture.FractureConfig;
import com.hellblazer.kinetica.simulation.fracture.SizeTierTable;
import com.hellblazer.kinetica.simulation.kinetics.KineticProfile;
import com.hellblazer.kinetica.simulation.projectile.ProjectileConfig;
import com.hellblazer.kinetica.simulation.steering.SteeringConfig;

import java.util.Objects;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.require;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requirePositive;

/**
 * Everything a {@link SimulationOrchestrator} is built from. Validated at construction; the sub-configurations
 * validate themselves.
 *
 * @param bounds             toroidal world
 * @param tickRate           fixed ticks per simulated second
 * @param seed               seed of the single random source shared by fracture, waves and pilots
 * @param maxTicksPerAdvance cap on ticks run by one {@link SimulationOrchestrator#advance(double)} call
 * @param autoAdvanceWaves   start the next wave as soon as the field is clear
 * @param fractureOnFirstHit a shot breaks an asteroid outright; when false, shots subtract damage from health first
 * @param shipRadius         collision radius of ships
 * @param projectiles        projectile pool
 * @param tiers              size-tier table
 * @param fracture           fragment scatter and placement
 * @param steering           autopilot tuning
 * @param shipProfile        physical constants of ships
 * @param asteroidProfile    physical constants of asteroids
 * @author hal.hildebrand
 */
public record SimulationConfig(WorldBounds bounds, float tickRate, long seed, int maxTicksPerAdvance,
                               boolean autoAdvanceWaves, boolean fractureOnFirstHit, float shipRadius,
                               ProjectileConfig projectiles, SizeTierTable tiers, FractureConfig fracture,
                               SteeringConfig steering, KineticProfile shipProfile, KineticProfile asteroidProfile) {

    public SimulationConfig {
        Objects.requireNonNull(bounds, "bounds cannot be null");
        requirePositive(tickRate, "tickRate");
        require(maxTicksPerAdvance > 0, "maxTicksPerAdvance must be positive, was " + maxTicksPerAdvance);
        requirePositive(shipRadius, "shipRadius");
        Objects.requireNonNull(projectiles, "projectiles cannot be null");
        Objects.requireNonNull(tiers, "tiers cannot be null");
        Objects.requireNonNull(fracture, "fracture cannot be null");
        Objects.requireNonNull(steering, "steering cannot be null");
        Objects.requireNonNull(shipProfile, "shipProfile cannot be null");
        Objects.requireNonNull(asteroidProfile, "asteroidProfile cannot be null");
    }

    /**
     * 160 × 144 world at 60 ticks per second.
     */
    public static SimulationConfig defaults() {
        return new SimulationConfig(new WorldBounds(160, 144), 60.0f, 42L, 5, false, true, 3.0f,
                                    ProjectileConfig.defaults(), SizeTierTable.defaults(), FractureConfig.defaults(),
                                    SteeringConfig.defaults(), KineticProfile.ship(), KineticProfile.asteroid());
    }

    public float tickSeconds() {
        return 1.0f / tickRate;
    }

    public SimulationConfig withBounds(WorldBounds bounds) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withTickRate(float tickRate) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withSeed(long seed) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withMaxTicksPerAdvance(int maxTicksPerAdvance) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withAutoAdvanceWaves(boolean autoAdvanceWaves) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withFractureOnFirstHit(boolean fractureOnFirstHit) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withProjectiles(ProjectileConfig projectiles) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withTiers(SizeTierTable tiers) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withFracture(FractureConfig fracture) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withSteering(SteeringConfig steering) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withShipProfile(KineticProfile shipProfile) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }

    public SimulationConfig withAsteroidProfile(KineticProfile asteroidProfile) {
        return new SimulationConfig(bounds, tickRate, seed, maxTicksPerAdvance, autoAdvanceWaves, fractureOnFirstHit,
                                    shipRadius, projectiles, tiers, fracture, steering, shipProfile, asteroidProfile);
    }
}
