package com.hellblazer.kinetica.simulation;

import com.hellblazer.kinetica.simulation.collision.ShipHit;
import com.hellblazer.kinetica.simulation.fracture.Wave;

/**
 * Receives simulation output. Called on the simulation thread, in tick order; implementations should return quickly.
 *
 * @author hal.hildebrand
 */
public interface SimulationListener {

    /**
     * A tick completed.
     */
    void onFrame(FrameSnapshot frame);

    default void onAsteroidDestroyed(AsteroidDestroyed event) {
    }

    default void onShipHit(ShipHit hit) {
    }

    default void onWaveStarted(Wave wave) {
    }
}
