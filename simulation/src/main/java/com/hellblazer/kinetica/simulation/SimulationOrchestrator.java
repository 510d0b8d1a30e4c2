package com.hellblazer.kinetica.simulation;

import com.hellblazer.kinetica.common.Result;
import com.hellblazer.kinetica.geometry.WorldBounds;
import com.hellblazer.kinetica.simulation.collision.CollisionBroadphase;
import com.hellblazer.kinetica.simulation.collision.CollisionStats;
import com.hellblazer.kinetica.simulation.collision.ProjectileHit;
import com.hellblazer.kinetica.simulation.entity.LongEntityID;
import com.hellblazer.kinetica.simulation.entity.SequentialLongIDGenerator;
import com.hellblazer.kinetica.simulation.entity.StringEntityID;
import com.hellblazer.kinetica.simulation.fracture.AsteroidFragment;
import com.hellblazer.kinetica.simulation.fracture.FractureSystem;
import com.hellblazer.kinetica.simulation.fracture.SafeZone;
import com.hellblazer.kinetica.simulation.fracture.Wave;
import com.hellblazer.kinetica.simulation.fracture.WaveSpawner;
import com.hellblazer.kinetica.simulation.kinetics.KineticEntity;
import com.hellblazer.kinetica.simulation.projectile.ProjectileSystem;
import com.hellblazer.kinetica.simulation.steering.SteeringPilot;
import com.hellblazer.kinetica.simulation.steering.Threat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Owns every body of one simulation and advances them at a fixed tick.
 * <p>
 * Each tick runs, in this order:
 * <ol>
 * <li>steering: every piloted ship's steering is computed from the positions left by the previous tick, then all of
 * it is applied</li>
 * <li>integration of ships, asteroids and shots</li>
 * <li>recycling of expired shots</li>
 * <li>collision detection and resolution: ship contacts are reported, struck asteroids are replaced in place by their
 * fragments and the shots are recycled</li>
 * <li>frame and telemetry output to listeners</li>
 * </ol>
 * An asteroid is destroyed at most once per tick and a shot strikes at most one asteroid. Fragments join the field at
 * the parent's place in the asteroid order and can be struck from the next tick on.
 * <p>
 * The single {@link Random} seeded from {@link SimulationConfig#seed()} feeds fracture, waves and pilots, so the same
 * seed and the same calls replay the same frames.
 * <p>
 * Not thread-safe; confine each instance to one thread.
 *
 * @author hal.hildebrand
 */
public class SimulationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SimulationOrchestrator.class);

    private final SimulationConfig                    config;
    private final WorldBounds                         bounds;
    private final float                               dt;
    private final Random                              random;
    private final SequentialLongIDGenerator           ids;
    private final ProjectileSystem                    projectiles;
    private final FractureSystem                      fracture;
    private final WaveSpawner                         waves;
    private final CollisionBroadphase                 broadphase = new CollisionBroadphase();
    private final Map<StringEntityID, Ship>           ships      = new LinkedHashMap<>();
    private final List<AsteroidFragment>              asteroids  = new ArrayList<>();
    private final List<SimulationListener>            listeners  = new ArrayList<>();

    private long          tick;
    private double        time;
    private double        accumulator;
    private TickTelemetry lastTelemetry = TickTelemetry.NONE;

    public SimulationOrchestrator(SimulationConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.bounds = config.bounds();
        this.dt = config.tickSeconds();
        this.random = new Random(config.seed());
        this.ids = new SequentialLongIDGenerator();
        this.projectiles = new ProjectileSystem(config.projectiles(), bounds, ids);
        this.fracture = new FractureSystem(config.tiers(), config.fracture(), config.asteroidProfile(), bounds, ids);
        this.waves = new WaveSpawner(fracture);
        log.info("Simulation ready: {}x{} world at {} ticks/s, seed {}", bounds.width(), bounds.height(),
                 config.tickRate(), config.seed());
    }

    public void addListener(SimulationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(SimulationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Place a ship at rest. Piloted ships get their own {@link SteeringPilot} drawing on the shared random source.
     *
     * @throws IllegalArgumentException if a ship with this id already exists
     */
    public Ship spawnShip(String id, Point2f position, boolean piloted) {
        var shipId = new StringEntityID(id);
        if (ships.containsKey(shipId)) {
            throw new IllegalArgumentException("Ship already exists: " + id);
        }
        var kinetics = new KineticEntity(config.shipProfile(), bounds, position, new Vector2f());
        var pilot = piloted ? new SteeringPilot(config.steering(), random) : null;
        var ship = new Ship(shipId, kinetics, config.shipRadius(), pilot);
        ships.put(shipId, ship);
        log.debug("Spawned {} at {}", shipId.toDebugString(), kinetics.getPosition());
        return ship;
    }

    public Result<Ship> despawnShip(String id) {
        var ship = ships.remove(new StringEntityID(id));
        if (ship == null) {
            log.debug("Despawn ignored, no ship {}", id);
            return Result.unknown(id);
        }
        return Result.success(ship);
    }

    public Result<Ship> getShip(String id) {
        var ship = ships.get(new StringEntityID(id));
        return ship == null ? Result.unknown(id) : Result.success(ship);
    }

    /**
     * Place one asteroid of {@code tier}.
     */
    public AsteroidFragment spawnAsteroid(int tier, Point2f position, Vector2f velocity) {
        var asteroid = fracture.createAsteroid(tier, position, velocity, random);
        asteroids.add(asteroid);
        return asteroid;
    }

    /**
     * Add an opening field of {@code count} asteroids, clear of {@code safeZone} when one is given.
     */
    public List<AsteroidFragment> populate(int count, SafeZone safeZone) {
        var created = fracture.createInitialAsteroids(count, safeZone, random);
        asteroids.addAll(created);
        return created;
    }

    public Result<AsteroidFragment> despawnAsteroid(LongEntityID id) {
        for (var it = asteroids.iterator(); it.hasNext(); ) {
            var asteroid = it.next();
            if (asteroid.getId().equals(id)) {
                it.remove();
                return Result.success(asteroid);
            }
        }
        log.debug("Despawn ignored, no asteroid {}", id);
        return Result.unknown(id);
    }

    /**
     * Fire from the nose of ship {@code shipId} along its heading, at the current simulation time.
     *
     * @return the shot's handle; {@link Result.Kind#UNKNOWN_ENTITY} for an unknown ship,
     *         {@link Result.Kind#RESOURCE_EXHAUSTED} when cooling down or out of shots
     */
    public Result<LongEntityID> fire(String shipId) {
        var ship = ships.get(new StringEntityID(shipId));
        if (ship == null) {
            log.debug("Fire ignored, no ship {}", shipId);
            return Result.unknown(shipId);
        }
        var kinetics = ship.getKinetics();
        var origin = kinetics.getPosition();
        var nose = kinetics.forward();
        origin.x += nose.x * ship.getRadius();
        origin.y += nose.y * ship.getRadius();
        return projectiles.fireProjectile(ship.getOwnerId(), origin, kinetics.getHeading(), time);
    }

    /**
     * Start the next wave, clear of {@code safeZone} when one is given.
     */
    public Wave startNextWave(SafeZone safeZone) {
        var wave = waves.startNextWave(safeZone, random);
        asteroids.addAll(wave.asteroids());
        for (var listener : listeners) {
            listener.onWaveStarted(wave);
        }
        return wave;
    }

    /**
     * Run as many whole ticks as {@code elapsed} seconds plus the carried remainder cover, at most
     * {@link SimulationConfig#maxTicksPerAdvance()} of them. Time beyond the cap is dropped.
     *
     * @return ticks run
     */
    public int advance(double elapsed) {
        if (elapsed < 0.0 || Double.isNaN(elapsed)) {
            throw new IllegalArgumentException("elapsed must be non-negative, was " + elapsed);
        }
        accumulator += elapsed;
        int run = 0;
        while (accumulator >= dt && run < config.maxTicksPerAdvance()) {
            tick();
            accumulator -= dt;
            run++;
        }
        if (accumulator >= dt) {
            log.debug("Dropping {}s of backlog after {} ticks", accumulator, run);
            accumulator = 0.0;
        }
        return run;
    }

    /**
     * Run exactly one tick.
     */
    public FrameSnapshot tick() {
        // 1. steering, all computed before any is applied
        steer();

        // 2. integration
        for (var ship : ships.values()) {
            ship.getKinetics().update(dt);
        }
        for (var asteroid : asteroids) {
            asteroid.getKinetics().update(dt);
        }
        projectiles.integrate(dt);
        tick++;
        time += dt;

        // 3. expiry
        int expired = projectiles.sweepExpired(time).size();

        // 4. collisions
        var shipHits = broadphase.detectShipHits(ships.values(), asteroids);
        long pairs = broadphase.getLastStats().pairsTested();
        var candidates = broadphase.detectProjectileHits(new ArrayList<>(projectiles.getActiveProjectiles()),
                                                         asteroids);
        var projectileHits = CollisionBroadphase.firstContacts(candidates);
        pairs += broadphase.getLastStats().pairsTested();

        for (var hit : shipHits) {
            hit.ship().recordHit();
            for (var listener : listeners) {
                listener.onShipHit(hit);
            }
        }
        var destroyed = resolveProjectileHits(projectileHits);
        int fragments = 0;
        for (var event : destroyed) {
            fragments += event.fragmentIds().size();
        }

        if (waves.update(dt, asteroids.size()) && config.autoAdvanceWaves()) {
            startNextWave(defaultSafeZone());
        }

        // 5. output
        lastTelemetry = new TickTelemetry(tick, ships.size(), asteroids.size(), projectiles.getActiveCount(),
                                          projectiles.getPooledCount(), expired, shipHits.size(), destroyed.size(),
                                          fragments, new CollisionStats(pairs, shipHits.size(),
                                                                        projectileHits.size()));
        var frame = snapshot();
        for (var event : destroyed) {
            for (var listener : listeners) {
                listener.onAsteroidDestroyed(event);
            }
        }
        for (var listener : listeners) {
            listener.onFrame(frame);
        }
        return frame;
    }

    /**
     * Views of every body and the last tick's telemetry.
     */
    public FrameSnapshot snapshot() {
        List<EntityView> views = new ArrayList<>(ships.size() + asteroids.size() + projectiles.getActiveCount());
        for (var ship : ships.values()) {
            var p = ship.getPosition();
            views.add(new EntityView(ship.getId(), EntityKind.SHIP, p.x, p.y, ship.getKinetics().getHeading(),
                                     ship.getRadius(), 0));
        }
        for (var asteroid : asteroids) {
            var p = asteroid.getPosition();
            views.add(new EntityView(asteroid.getId(), EntityKind.ASTEROID, p.x, p.y,
                                     asteroid.getKinetics().getHeading(), asteroid.getRadius(), asteroid.getSize()));
        }
        for (var projectile : projectiles.getActiveProjectiles()) {
            var p = projectile.getPosition();
            views.add(new EntityView(projectile.getId(), EntityKind.PROJECTILE, p.x, p.y, projectile.getHeading(),
                                     projectile.getRadius(), 0));
        }
        return new FrameSnapshot(tick, time, waves.getCurrentWave(), views, lastTelemetry);
    }

    public List<AsteroidFragment> getAsteroids() {
        return Collections.unmodifiableList(asteroids);
    }

    public List<Ship> getShips() {
        return List.copyOf(ships.values());
    }

    public ProjectileSystem getProjectiles() {
        return projectiles;
    }

    public FractureSystem getFracture() {
        return fracture;
    }

    public WaveSpawner getWaves() {
        return waves;
    }

    public CollisionBroadphase getBroadphase() {
        return broadphase;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public long getTick() {
        return tick;
    }

    public double getTime() {
        return time;
    }

    private void steer() {
        List<Ship> piloted = new ArrayList<>();
        for (var ship : ships.values()) {
            if (ship.isPiloted()) {
                piloted.add(ship);
            }
        }
        if (piloted.isEmpty()) {
            return;
        }
        List<Threat> threats = new ArrayList<>(asteroids.size());
        for (var asteroid : asteroids) {
            threats.add(Threat.of(asteroid));
        }
        List<Vector2f> steering = new ArrayList<>(piloted.size());
        for (var ship : piloted) {
            steering.add(ship.getPilot().computeSteering(ship.getKinetics(), threats, bounds));
        }
        for (int i = 0; i < piloted.size(); i++) {
            var ship = piloted.get(i);
            ship.getPilot().applyToShip(steering.get(i), ship.getKinetics(), dt);
        }
    }

    private List<AsteroidDestroyed> resolveProjectileHits(List<ProjectileHit> hits) {
        if (hits.isEmpty()) {
            return List.of();
        }
        Map<LongEntityID, List<AsteroidFragment>> replacements = new HashMap<>();
        List<AsteroidDestroyed> destroyed = new ArrayList<>();
        for (var hit : hits) {
            var projectile = hit.projectile();
            var handle = projectile.getId();
            var owner = projectile.getOwnerId();
            float damage = projectile.getDamage();
            float impactAngle = hit.impactAngle();
            projectiles.deactivate(handle);

            var asteroid = hit.asteroid();
            boolean broken = asteroid.takeDamage(damage) || config.fractureOnFirstHit();
            if (!broken) {
                log.debug("{} took {} damage, {} left", asteroid.getId().toDebugString(), damage,
                          asteroid.getHealth());
                continue;
            }
            var pieces = fracture.fractureAsteroid(asteroid, impactAngle, random);
            replacements.put(asteroid.getId(), pieces);
            destroyed.add(new AsteroidDestroyed(tick, asteroid.getId(), asteroid.getSize(), asteroid.getPoints(), owner,
                                                handle, pieces.stream().map(AsteroidFragment::getId).toList()));
        }
        if (!replacements.isEmpty()) {
            List<AsteroidFragment> next = new ArrayList<>(asteroids.size() + replacements.size());
            for (var asteroid : asteroids) {
                var pieces = replacements.get(asteroid.getId());
                if (pieces == null) {
                    next.add(asteroid);
                } else {
                    next.addAll(pieces);
                }
            }
            asteroids.clear();
            asteroids.addAll(next);
        }
        return destroyed;
    }

    private SafeZone defaultSafeZone() {
        if (ships.isEmpty()) {
            return null;
        }
        return waves.safeZoneAround(ships.values().iterator().next().getPosition());
    }

    @Override
    public String toString() {
        return String.format("SimulationOrchestrator[tick=%d, time=%.3f, ships=%d, asteroids=%d, shots=%d]", tick,
                             time, ships.size(), asteroids.size(), projectiles.getActiveCount());
    }
}
