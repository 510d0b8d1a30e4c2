package com.hellblazer.kinetica.simulation.fracture;

import com.hellblazer.kinetica.geometry.DeterministicMath;
import com.hellblazer.kinetica.geometry.WorldBounds;
import com.hellblazer.kinetica.simulation.entity.EntityIDGenerator;
import com.hellblazer.kinetica.simulation.entity.LongEntityID;
import com.hellblazer.kinetica.simulation.kinetics.KineticEntity;
import com.hellblazer.kinetica.simulation.kinetics.KineticProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;

/**
 * Creates and breaks apart destructible bodies according to a {@link SizeTierTable}.
 * <p>
 * The system holds no bodies. Fracturing returns the fragments as new values and the caller decides where they live;
 * the parent is left untouched. All randomness comes from the {@link Random} passed to each call, so the same seed
 * reproduces the same fragments.
 * <p>
 * Usage:
 * <pre>
 * var fracture = new FractureSystem(SizeTierTable.defaults(), FractureConfig.defaults(), bounds, ids);
 * var field = fracture.createInitialAsteroids(5, new SafeZone(ship.getPosition(), 20), random);
 * ...
 * var pieces = fracture.fractureAsteroid(hit, projectile.getHeading(), random);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class FractureSystem {

    private static final Logger log = LoggerFactory.getLogger(FractureSystem.class);

    private static final int              BASE_WAVE_ASTEROIDS  = 4;
    private static final int              ASTEROIDS_PER_WAVE   = 2;
    private static final int              MAX_WAVE_ASTEROIDS   = 12;
    private static final float            SPEED_STEP_PER_WAVE  = 0.1f;
    private static final List<Integer>    INITIAL_TIER_WEIGHTS = List.of(3, 3, 2, 2, 1);
    private static final List<List<Integer>> WAVE_TIER_WEIGHTS = List.of(List.of(3, 3, 2, 2, 1),
                                                                         List.of(3, 2, 2, 1, 1),
                                                                         List.of(2, 2, 1, 1, 1),
                                                                         List.of(2, 1, 1, 1, 1));

    private final SizeTierTable                   table;
    private final FractureConfig                  config;
    private final KineticProfile                  profile;
    private final WorldBounds                     bounds;
    private final EntityIDGenerator<LongEntityID> ids;

    private long fractured;
    private long fragmentsCreated;
    private long spawned;

    public FractureSystem(SizeTierTable table, FractureConfig config, WorldBounds bounds,
                          EntityIDGenerator<LongEntityID> ids) {
        this(table, config, KineticProfile.asteroid(), bounds, ids);
    }

    public FractureSystem(SizeTierTable table, FractureConfig config, KineticProfile profile, WorldBounds bounds,
                          EntityIDGenerator<LongEntityID> ids) {
        this.table = Objects.requireNonNull(table, "table cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.profile = Objects.requireNonNull(profile, "profile cannot be null");
        this.bounds = Objects.requireNonNull(bounds, "bounds cannot be null");
        this.ids = Objects.requireNonNull(ids, "ids cannot be null");
    }

    /**
     * Create one body of {@code tier} with a random spin heading.
     */
    public AsteroidFragment createAsteroid(int tier, Point2f position, Vector2f velocity, Random random) {
        var kinetics = new KineticEntity(profile, bounds, position, velocity);
        kinetics.setHeading(random.nextFloat() * DeterministicMath.TWO_PI);
        return new AsteroidFragment(ids.generateID(), kinetics, table.get(tier));
    }

    /**
     * Break {@code asteroid} into the child tier's fragments.
     * <p>
     * Fragments fan out across the scatter cone centered on {@code impactAngle}, or on a random angle when it is
     * null. Each keeps a share of the parent velocity plus its own scatter velocity, and starts within the position
     * jitter of the parent center.
     *
     * @return exactly {@code childCount} new fragments, or an empty list for the terminal tier
     */
    public List<AsteroidFragment> fractureAsteroid(AsteroidFragment asteroid, Float impactAngle, Random random) {
        var tier = asteroid.getTier();
        fractured++;
        if (tier.isTerminal()) {
            log.debug("{} is terminal, no fragments", asteroid.getId().toDebugString());
            return List.of();
        }

        int n = tier.childCount();
        float base = impactAngle != null ? impactAngle : random.nextFloat() * DeterministicMath.TWO_PI;
        var parentPosition = asteroid.getPosition();
        var parentVelocity = asteroid.getKinetics().getVelocity();
        float jitter = config.positionJitter();

        List<AsteroidFragment> fragments = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            float angle = base + (i - n / 2.0f) * (config.scatterCone() / n);
            float speed = uniform(random, config.minFragmentSpeed(), config.maxFragmentSpeed());
            var velocity = new Vector2f(parentVelocity.x * config.velocityInheritance()
                                        + DeterministicMath.cos(angle) * speed,
                                        parentVelocity.y * config.velocityInheritance()
                                        + DeterministicMath.sin(angle) * speed);
            var position = new Point2f(parentPosition.x + uniform(random, -jitter, jitter),
                                       parentPosition.y + uniform(random, -jitter, jitter));
            fragments.add(createAsteroid(tier.childTier(), position, velocity, random));
        }
        fragmentsCreated += n;
        log.debug("{} (tier {}) fractured into {} tier {} fragments", asteroid.getId().toDebugString(), tier.tier(), n,
                  tier.childTier());
        return fragments;
    }

    /**
     * Create the opening field: tiers drawn from {@code [3, 3, 2, 2, 1]}, positions inside the spawn margin and
     * clear of {@code safeZone} when one is given, velocity components within the initial range.
     */
    public List<AsteroidFragment> createInitialAsteroids(int count, SafeZone safeZone, Random random) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, was " + count);
        }
        validateWeights(INITIAL_TIER_WEIGHTS);
        float range = config.initialVelocityRange();
        List<AsteroidFragment> asteroids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            var position = placement(safeZone, random);
            var velocity = new Vector2f(uniform(random, -range, range), uniform(random, -range, range));
            int tier = INITIAL_TIER_WEIGHTS.get(random.nextInt(INITIAL_TIER_WEIGHTS.size()));
            asteroids.add(createAsteroid(tier, position, velocity, random));
        }
        spawned += count;
        log.debug("Created {} initial asteroids", count);
        return asteroids;
    }

    /**
     * Difficulty for 1-based {@code waveNumber}: the count grows by two per wave from four up to twelve, speed grows by
     * ten percent per wave, and every two waves the tier weights shift toward smaller bodies.
     */
    public WaveParameters calculateWaveDifficulty(int waveNumber) {
        if (waveNumber < 1) {
            throw new IllegalArgumentException("waveNumber must be >= 1, was " + waveNumber);
        }
        int count = Math.min(BASE_WAVE_ASTEROIDS + (waveNumber - 1) * ASTEROIDS_PER_WAVE, MAX_WAVE_ASTEROIDS);
        float speed = 1.0f + (waveNumber - 1) * SPEED_STEP_PER_WAVE;
        var weights = WAVE_TIER_WEIGHTS.get(Math.min((waveNumber - 1) / 2, WAVE_TIER_WEIGHTS.size() - 1));
        return new WaveParameters(waveNumber, count, speed, weights);
    }

    /**
     * Spawn the asteroids of one wave: tiers drawn from the difficulty's weights, base speed uniform in the wave speed
     * range scaled by the speed multiplier, heading uniform over the full circle.
     *
     * @throws IllegalArgumentException if the weights name a tier missing from the table
     */
    public List<AsteroidFragment> createWave(WaveParameters difficulty, SafeZone safeZone, Random random) {
        validateWeights(difficulty.tierWeights());
        var weights = difficulty.tierWeights();
        List<AsteroidFragment> asteroids = new ArrayList<>(difficulty.asteroidCount());
        for (int i = 0; i < difficulty.asteroidCount(); i++) {
            var position = placement(safeZone, random);
            float speed = uniform(random, config.waveMinSpeed(), config.waveMaxSpeed()) * difficulty.speedMultiplier();
            float angle = random.nextFloat() * DeterministicMath.TWO_PI;
            var velocity = new Vector2f(DeterministicMath.cos(angle) * speed, DeterministicMath.sin(angle) * speed);
            int tier = weights.get(random.nextInt(weights.size()));
            asteroids.add(createAsteroid(tier, position, velocity, random));
        }
        spawned += difficulty.asteroidCount();
        log.info("Wave {}: {} asteroids at speed x{}", difficulty.waveNumber(), difficulty.asteroidCount(),
                 difficulty.speedMultiplier());
        return asteroids;
    }

    /**
     * Score still on the field.
     */
    public static int getTotalPoints(Collection<AsteroidFragment> asteroids) {
        int total = 0;
        for (var asteroid : asteroids) {
            total += asteroid.getPoints();
        }
        return total;
    }

    /**
     * Count of bodies per tier id, ascending.
     */
    public static Map<Integer, Integer> getSizeDistribution(Collection<AsteroidFragment> asteroids) {
        Map<Integer, Integer> distribution = new TreeMap<>();
        for (var asteroid : asteroids) {
            distribution.merge(asteroid.getSize(), 1, Integer::sum);
        }
        return distribution;
    }

    /**
     * A wave is complete when nothing is left to destroy.
     */
    public static boolean shouldSpawnNewWave(Collection<AsteroidFragment> asteroids) {
        return asteroids.isEmpty();
    }

    public SizeTierTable getTable() {
        return table;
    }

    public FractureConfig getConfig() {
        return config;
    }

    public FractureStats getStats() {
        return new FractureStats(fractured, fragmentsCreated, spawned);
    }

    private Point2f placement(SafeZone safeZone, Random random) {
        float margin = config.spawnMargin();
        float maxX = Math.max(margin, bounds.width() - margin);
        float maxY = Math.max(margin, bounds.height() - margin);
        if (safeZone == null) {
            return new Point2f(uniform(random, margin, maxX), uniform(random, margin, maxY));
        }
        for (int attempt = 0; attempt < config.placementAttempts(); attempt++) {
            var candidate = new Point2f(uniform(random, margin, maxX), uniform(random, margin, maxY));
            if (safeZone.isClear(candidate, config.safeZonePadding())) {
                return candidate;
            }
        }
        // Fall back to one of the four edges
        return switch (random.nextInt(4)) {
            case 0 -> new Point2f(margin, uniform(random, margin, maxY));
            case 1 -> new Point2f(maxX, uniform(random, margin, maxY));
            case 2 -> new Point2f(uniform(random, margin, maxX), margin);
            default -> new Point2f(uniform(random, margin, maxX), maxY);
        };
    }

    private void validateWeights(List<Integer> weights) {
        for (int tier : weights) {
            if (!table.contains(tier)) {
                throw new IllegalArgumentException("Tier weight names unknown tier " + tier + " in " + table);
            }
        }
    }

    private static float uniform(Random random, float min, float max) {
        return min + random.nextFloat() * (max - min);
    }
}
