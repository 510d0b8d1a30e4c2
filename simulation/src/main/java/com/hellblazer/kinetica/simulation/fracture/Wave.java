package com.hellblazer.kinetica.simulation.fracture;

import java.util.List;

/**
 * A started wave: its difficulty and the asteroids spawned for it.
 */
public record Wave(WaveParameters parameters, List<AsteroidFragment> asteroids) {

    public Wave {
        asteroids = List.copyOf(asteroids);
    }

    public int number() {
        return parameters.waveNumber();
    }
}
