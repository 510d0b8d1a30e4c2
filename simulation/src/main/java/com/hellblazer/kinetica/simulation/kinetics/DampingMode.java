package com.hellblazer.kinetica.simulation.kinetics;

/**
 * How {@link KineticProfile#drag()} is applied on each {@link KineticEntity#update(float)}.
 *
 * @author hal.hildebrand
 */
public enum DampingMode {
    /**
     * Velocity is multiplied by {@code drag} once per update, whatever the step size. Motion depends on the tick rate.
     */
    PER_TICK,
    /**
     * Velocity is multiplied by {@code drag^(dt · referenceRate)}. At the reference rate this matches
     * {@link #PER_TICK}; other step sizes decay the same amount per simulated second.
     */
    EXPONENTIAL
}
