package com.hellblazer.kinetica.simulation.kinetics;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.require;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requirePositive;

/**
 * Physical constants of a kinetic body.
 *
 * @param mass          positive mass; thrust acceleration is {@code thrustPower / mass}
 * @param thrustPower   force produced at full throttle
 * @param drag          velocity retention factor in (0, 1]; 1 means no damping
 * @param maxVelocity   speed cap enforced after every thrust and update
 * @param dampingMode   how drag scales with the step size
 * @param referenceRate ticks per second at which {@link DampingMode#EXPONENTIAL} matches per-tick damping
 * @author hal.hildebrand
 */
public record KineticProfile(float mass, float thrustPower, float drag, float maxVelocity, DampingMode dampingMode,
                             float referenceRate) {

    public KineticProfile {
        requirePositive(mass, "mass");
        require(Float.isFinite(thrustPower) && thrustPower >= 0.0f, "thrustPower must be non-negative");
        require(drag > 0.0f && drag <= 1.0f, "drag must lie in (0, 1], was " + drag);
        requirePositive(maxVelocity, "maxVelocity");
        require(dampingMode != null, "dampingMode cannot be null");
        requirePositive(referenceRate, "referenceRate");
    }

    /**
     * Player or pilot controlled craft.
     */
    public static KineticProfile ship() {
        return new KineticProfile(1.0f, 120.0f, 0.99f, 120.0f, DampingMode.PER_TICK, 60.0f);
    }

    /**
     * Drifting rock: no thrust, no damping.
     */
    public static KineticProfile asteroid() {
        return new KineticProfile(3.0f, 0.0f, 1.0f, 200.0f, DampingMode.PER_TICK, 60.0f);
    }

    /**
     * Ballistic shot capped at {@code maxSpeed}.
     */
    public static KineticProfile projectile(float maxSpeed) {
        return new KineticProfile(0.1f, 0.0f, 1.0f, maxSpeed, DampingMode.PER_TICK, 60.0f);
    }

    public KineticProfile withMass(float mass) {
        return new KineticProfile(mass, thrustPower, drag, maxVelocity, dampingMode, referenceRate);
    }

    public KineticProfile withThrustPower(float thrustPower) {
        return new KineticProfile(mass, thrustPower, drag, maxVelocity, dampingMode, referenceRate);
    }

    public KineticProfile withDrag(float drag) {
        return new KineticProfile(mass, thrustPower, drag, maxVelocity, dampingMode, referenceRate);
    }

    public KineticProfile withMaxVelocity(float maxVelocity) {
        return new KineticProfile(mass, thrustPower, drag, maxVelocity, dampingMode, referenceRate);
    }

    public KineticProfile withDampingMode(DampingMode dampingMode) {
        return new KineticProfile(mass, thrustPower, drag, maxVelocity, dampingMode, referenceRate);
    }

    public KineticProfile withReferenceRate(float referenceRate) {
        return new KineticProfile(mass, thrustPower, drag, maxVelocity, dampingMode, referenceRate);
    }
}
