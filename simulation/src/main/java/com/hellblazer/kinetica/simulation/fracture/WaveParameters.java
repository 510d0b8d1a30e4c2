package com.hellblazer.kinetica.simulation.fracture;

import java.util.List;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.require;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requirePositive;

/**
 * Difficulty of one wave.
 *
 * @param waveNumber      1-based wave index
 * @param asteroidCount   asteroids spawned for the wave
 * @param speedMultiplier scale applied to the base wave speed
 * @param tierWeights     bag of tier ids; each asteroid's tier is drawn uniformly from it, so repeats weight a tier
 * @author hal.hildebrand
 */
public record WaveParameters(int waveNumber, int asteroidCount, float speedMultiplier, List<Integer> tierWeights) {

    public WaveParameters {
        require(waveNumber > 0, "waveNumber must be positive, was " + waveNumber);
        require(asteroidCount >= 0, "asteroidCount must be non-negative, was " + asteroidCount);
        requirePositive(speedMultiplier, "speedMultiplier");
        require(tierWeights != null && !tierWeights.isEmpty(), "tierWeights cannot be empty");
        tierWeights = List.copyOf(tierWeights);
    }
}
