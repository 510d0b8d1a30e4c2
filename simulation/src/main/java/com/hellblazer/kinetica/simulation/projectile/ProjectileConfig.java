package com.hellblazer.kinetica.simulation.projectile;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.require;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requireNonNegative;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requirePositive;

/**
 * Configuration for the projectile pool.
 *
 * @param poolSize    number of preallocated projectile slots, fixed for the life of the system
 * @param cooldownMs  minimum simulation time between two shots of the same owner, in milliseconds
 * @param lifetime    seconds a shot stays active before it is recycled
 * @param radius      collision radius of a shot
 * @param muzzleSpeed speed used when the caller does not choose one
 * @param damage      damage used when the caller does not choose one
 * @param maxSpeed    fastest shot the pool accepts; faster requests are rejected rather than slowed
 * @author hal.hildebrand
 */
public record ProjectileConfig(int poolSize, double cooldownMs, double lifetime, float radius, float muzzleSpeed,
                               float damage, float maxSpeed) {

    public ProjectileConfig {
        require(poolSize > 0, "poolSize must be positive, was " + poolSize);
        require(Double.isFinite(cooldownMs) && cooldownMs >= 0.0, "cooldownMs must be non-negative, was " + cooldownMs);
        require(Double.isFinite(lifetime) && lifetime > 0.0, "lifetime must be positive, was " + lifetime);
        requirePositive(radius, "radius");
        requirePositive(muzzleSpeed, "muzzleSpeed");
        requireNonNegative(damage, "damage");
        requirePositive(maxSpeed, "maxSpeed");
        require(muzzleSpeed <= maxSpeed, "muzzleSpeed " + muzzleSpeed + " exceeds maxSpeed " + maxSpeed);
    }

    public static ProjectileConfig defaults() {
        return new ProjectileConfig(32, 150.0, 1.0, 1.0f, 150.0f, 1.0f, 400.0f);
    }

    /**
     * Cooldown converted to seconds of simulation time.
     */
    public double cooldownSeconds() {
        return cooldownMs / 1000.0;
    }

    public ProjectileConfig withPoolSize(int poolSize) {
        return new ProjectileConfig(poolSize, cooldownMs, lifetime, radius, muzzleSpeed, damage, maxSpeed);
    }

    public ProjectileConfig withCooldownMs(double cooldownMs) {
        return new ProjectileConfig(poolSize, cooldownMs, lifetime, radius, muzzleSpeed, damage, maxSpeed);
    }

    public ProjectileConfig withLifetime(double lifetime) {
        return new ProjectileConfig(poolSize, cooldownMs, lifetime, radius, muzzleSpeed, damage, maxSpeed);
    }

    public ProjectileConfig withRadius(float radius) {
        return new ProjectileConfig(poolSize, cooldownMs, lifetime, radius, muzzleSpeed, damage, maxSpeed);
    }

    public ProjectileConfig withMuzzleSpeed(float muzzleSpeed) {
        return new ProjectileConfig(poolSize, cooldownMs, lifetime, radius, muzzleSpeed, damage, maxSpeed);
    }

    public ProjectileConfig withDamage(float damage) {
        return new ProjectileConfig(poolSize, cooldownMs, lifetime, radius, muzzleSpeed, damage, maxSpeed);
    }

    public ProjectileConfig withMaxSpeed(float maxSpeed) {
        return new ProjectileConfig(poolSize, cooldownMs, lifetime, radius, muzzleSpeed, damage, maxSpeed);
    }
}
