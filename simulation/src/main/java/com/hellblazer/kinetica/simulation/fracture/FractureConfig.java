package com.hellblazer.kinetica.simulation.fracture;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.require;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requireNonNegative;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requirePositive;

/**
 * Tuning for fragment scatter and asteroid placement.
 *
 * @param minFragmentSpeed        lower bound of a fragment's scatter speed
 * @param maxFragmentSpeed        upper bound of a fragment's scatter speed
 * @param scatterCone             angular width, in radians, fragments fan out over
 * @param positionJitter          fragments spawn within ± this of the parent center on each axis
 * @param velocityInheritance     fraction of the parent velocity each fragment keeps
 * @param spawnMargin             new asteroids keep this far from the world edges
 * @param initialVelocityRange    initial asteroids draw each velocity component from ± this
 * @param placementAttempts       random placements tried before falling back to an edge
 * @param safeZonePadding         extra clearance beyond a safe zone's radius
 * @param waveMinSpeed            lower bound of a wave asteroid's base speed
 * @param waveMaxSpeed            upper bound of a wave asteroid's base speed
 * @author hal.hildebrand
 */
public record FractureConfig(float minFragmentSpeed, float maxFragmentSpeed, float scatterCone, float positionJitter,
                             float velocityInheritance, float spawnMargin, float initialVelocityRange,
                             int placementAttempts, float safeZonePadding, float waveMinSpeed, float waveMaxSpeed) {

    public FractureConfig {
        requireNonNegative(minFragmentSpeed, "minFragmentSpeed");
        require(maxFragmentSpeed >= minFragmentSpeed, "maxFragmentSpeed must be >= minFragmentSpeed");
        requireNonNegative(scatterCone, "scatterCone");
        requireNonNegative(positionJitter, "positionJitter");
        requireNonNegative(velocityInheritance, "velocityInheritance");
        requireNonNegative(spawnMargin, "spawnMargin");
        requireNonNegative(initialVelocityRange, "initialVelocityRange");
        require(placementAttempts > 0, "placementAttempts must be positive");
        requireNonNegative(safeZonePadding, "safeZonePadding");
        requirePositive(waveMaxSpeed, "waveMaxSpeed");
        require(waveMinSpeed >= 0.0f && waveMinSpeed <= waveMaxSpeed, "waveMinSpeed must lie in [0, waveMaxSpeed]");
    }

    public static FractureConfig defaults() {
        return new FractureConfig(15.0f, 40.0f, (float) (Math.PI / 3.0), 2.0f, 0.5f, 20.0f, 30.0f, 50, 10.0f, 15.0f,
                                  30.0f);
    }

    public FractureConfig withFragmentSpeed(float min, float max) {
        return new FractureConfig(min, max, scatterCone, positionJitter, velocityInheritance, spawnMargin,
                                  initialVelocityRange, placementAttempts, safeZonePadding, waveMinSpeed,
                                  waveMaxSpeed);
    }

    public FractureConfig withPositionJitter(float positionJitter) {
        return new FractureConfig(minFragmentSpeed, maxFragmentSpeed, scatterCone, positionJitter,
                                  velocityInheritance, spawnMargin, initialVelocityRange, placementAttempts,
                                  safeZonePadding, waveMinSpeed, waveMaxSpeed);
    }

    public FractureConfig withSpawnMargin(float spawnMargin) {
        return new FractureConfig(minFragmentSpeed, maxFragmentSpeed, scatterCone, positionJitter,
                                  velocityInheritance, spawnMargin, initialVelocityRange, placementAttempts,
                                  safeZonePadding, waveMinSpeed, waveMaxSpeed);
    }
}
