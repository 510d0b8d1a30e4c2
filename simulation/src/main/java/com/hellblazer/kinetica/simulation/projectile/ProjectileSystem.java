package com.hellblazer.kinetica.simulation.projectile;

import com.hellblazer.kinetica.common.Result;
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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed-capacity projectile pool with per-owner fire cooldowns.
 * <p>
 * All slots are allocated at construction. Every slot is always in exactly one of the pool or the active set, so
 * {@code pooled + active == poolSize} holds between any two calls. Firing never allocates and never throws for
 * routine conditions: an empty pool or an unexpired cooldown is reported as
 * {@link Result.Kind#RESOURCE_EXHAUSTED}.
 * <p>
 * Times are simulation seconds supplied by the caller. Cooldowns are tracked per owner, and owners never block each
 * other.
 * <p>
 * Not thread-safe.
 *
 * @author hal.hildebrand
 */
public class ProjectileSystem {

    private static final Logger log = LoggerFactory.getLogger(ProjectileSystem.class);

    private final ProjectileConfig                  config;
    private final EntityIDGenerator<LongEntityID>   handles;
    private final ArrayDeque<Projectile>            pool;
    private final Map<LongEntityID, Projectile>     active       = new LinkedHashMap<>();
    private final Map<String, Double>               lastFireTime = new HashMap<>();
    private final double                            cooldown;

    private long fired;
    private long rejected;
    private long expired;
    private long recycled;

    public ProjectileSystem(ProjectileConfig config, WorldBounds bounds, EntityIDGenerator<LongEntityID> handles) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.handles = Objects.requireNonNull(handles, "handles cannot be null");
        Objects.requireNonNull(bounds, "bounds cannot be null");
        this.cooldown = config.cooldownSeconds();
        this.pool = new ArrayDeque<>(config.poolSize());
        var profile = KineticProfile.projectile(config.maxSpeed());
        for (int i = 0; i < config.poolSize(); i++) {
            pool.push(new Projectile(new KineticEntity(profile, bounds)));
        }
        log.debug("Projectile pool ready: {} slots, cooldown {}s, lifetime {}s", config.poolSize(), cooldown,
                  config.lifetime());
    }

    /**
     * @return true iff a slot is free and {@code ownerId} has never fired or its cooldown has elapsed at {@code now}
     */
    public boolean canFire(String ownerId, double now) {
        if (pool.isEmpty()) {
            return false;
        }
        var last = lastFireTime.get(ownerId);
        return last == null || now >= last + cooldown;
    }

    /**
     * Fire with the configured muzzle speed and damage.
     */
    public Result<LongEntityID> fireProjectile(String ownerId, Point2f origin, float angle, double now) {
        return fireProjectile(ownerId, origin, angle, now, config.damage(), config.muzzleSpeed());
    }

    /**
     * Launch a shot from {@code origin} along {@code angle} at {@code speed}.
     *
     * @return the new shot's handle, or {@link Result.Kind#RESOURCE_EXHAUSTED} when the pool is empty or the owner
     *         is still cooling down
     * @throws IllegalArgumentException if {@code speed} is negative or exceeds {@link ProjectileConfig#maxSpeed()}
     */
    public Result<LongEntityID> fireProjectile(String ownerId, Point2f origin, float angle, double now, float damage,
                                               float speed) {
        Objects.requireNonNull(ownerId, "ownerId cannot be null");
        if (!(speed >= 0.0f && speed <= config.maxSpeed())) {
            throw new IllegalArgumentException("speed must lie in [0, " + config.maxSpeed() + "], was " + speed);
        }
        if (pool.isEmpty()) {
            rejected++;
            log.debug("Fire rejected for {}: pool empty ({} active)", ownerId, active.size());
            return Result.exhausted("Projectile pool empty");
        }
        if (!canFire(ownerId, now)) {
            rejected++;
            log.debug("Fire rejected for {}: cooling down for {}s", ownerId, getCooldownRemaining(ownerId, now));
            return Result.exhausted("Cooldown active for " + ownerId);
        }

        var projectile = pool.pop();
        var handle = handles.generateID();
        var kinetics = projectile.getKinetics();
        kinetics.setPosition(origin);
        kinetics.setHeading(angle);
        kinetics.setVelocity(new Vector2f(DeterministicMath.cos(angle) * speed, DeterministicMath.sin(angle) * speed));
        projectile.activate(handle, ownerId, damage, now, config.lifetime(), config.radius());

        active.put(handle, projectile);
        lastFireTime.put(ownerId, now);
        fired++;
        return Result.success(handle);
    }

    /**
     * Advance every active shot by {@code dt}, then recycle the ones whose lifetime has run out at {@code now}.
     *
     * @return handles recycled by this call, in firing order
     */
    public List<LongEntityID> update(float dt, double now) {
        integrate(dt);
        return sweepExpired(now);
    }

    /**
     * Move every active shot by {@code dt}.
     */
    public void integrate(float dt) {
        for (var projectile : active.values()) {
            projectile.getKinetics().update(dt);
        }
    }

    /**
     * Return every shot with {@code now - spawnTime > lifetime} to the pool.
     *
     * @return the recycled handles, in firing order
     */
    public List<LongEntityID> sweepExpired(double now) {
        List<LongEntityID> swept = new ArrayList<>();
        Iterator<Map.Entry<LongEntityID, Projectile>> it = active.entrySet().iterator();
        while (it.hasNext()) {
            var entry = it.next();
            if (entry.getValue().isExpired(now)) {
                it.remove();
                recycle(entry.getValue());
                swept.add(entry.getKey());
                expired++;
            }
        }
        return swept;
    }

    /**
     * Return the shot behind {@code handle} to the pool, typically after it struck something.
     *
     * @return the released slot, or {@link Result.Kind#UNKNOWN_ENTITY} when the handle is unknown or already
     *         recycled
     */
    public Result<Projectile> deactivate(LongEntityID handle) {
        var projectile = active.remove(handle);
        if (projectile == null) {
            log.debug("Deactivate ignored, no active projectile {}", handle);
            return Result.unknown(handle);
        }
        recycle(projectile);
        return Result.success(projectile);
    }

    /**
     * Recycle every active shot and forget all cooldowns.
     */
    public void clearAll() {
        for (var projectile : active.values()) {
            recycle(projectile);
        }
        active.clear();
        lastFireTime.clear();
    }

    /**
     * Seconds until {@code ownerId} may fire again. Zero for owners that never fired, and exactly zero from
     * {@code lastFire + cooldown} on.
     */
    public double getCooldownRemaining(String ownerId, double now) {
        var last = lastFireTime.get(ownerId);
        if (last == null) {
            return 0.0;
        }
        return Math.max(0.0, (last + cooldown) - now);
    }

    public Result<Projectile> getProjectile(LongEntityID handle) {
        var projectile = active.get(handle);
        return projectile == null ? Result.unknown(handle) : Result.success(projectile);
    }

    /**
     * Active shots in firing order. The view is live and unmodifiable.
     */
    public Collection<Projectile> getActiveProjectiles() {
        return Collections.unmodifiableCollection(active.values());
    }

    public int getActiveCount() {
        return active.size();
    }

    public int getPooledCount() {
        return pool.size();
    }

    public ProjectileConfig getConfig() {
        return config;
    }

    public ProjectileStats getStats() {
        return new ProjectileStats(fired, rejected, expired, recycled, active.size(), pool.size());
    }

    private void recycle(Projectile projectile) {
        projectile.release();
        pool.push(projectile);
        recycled++;
    }
}
