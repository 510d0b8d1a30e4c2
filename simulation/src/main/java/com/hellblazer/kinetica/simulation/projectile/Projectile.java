package com.hellblazer.kinetica.simulation.projectile;

import com.hellblazer.kinetica.simulation.collision.Collidable;
import com.hellblazer.kinetica.simulation.entity.LongEntityID;
import com.hellblazer.kinetica.simulation.kinetics.KineticEntity;

import javax.vecmath.Point2f;

/**
 * One slot of the projectile pool. The slot and its {@link KineticEntity} are reused across shots; the handle is
 * fresh for every shot, so a handle held after recycling no longer resolves.
 *
 * @author hal.hildebrand
 */
public class Projectile implements Collidable {

    private final KineticEntity kinetics;
    private       LongEntityID  handle;
    private       String        ownerId;
    private       float         damage;
    private       double        spawnTime;
    private       double        lifetime;
    private       float         radius;

    Projectile(KineticEntity kinetics) {
        this.kinetics = kinetics;
    }

    void activate(LongEntityID handle, String ownerId, float damage, double spawnTime, double lifetime,
                  float radius) {
        this.handle = handle;
        this.ownerId = ownerId;
        this.damage = damage;
        this.spawnTime = spawnTime;
        this.lifetime = lifetime;
        this.radius = radius;
    }

    void release() {
        handle = null;
        ownerId = null;
        kinetics.stop();
    }

    /**
     * @return true once {@code now - spawnTime} exceeds the lifetime
     */
    public boolean isExpired(double now) {
        return now - spawnTime > lifetime;
    }

    public boolean isActive() {
        return handle != null;
    }

    @Override
    public LongEntityID getId() {
        return handle;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public float getDamage() {
        return damage;
    }

    public double getSpawnTime() {
        return spawnTime;
    }

    public double getLifetime() {
        return lifetime;
    }

    @Override
    public float getRadius() {
        return radius;
    }

    @Override
    public Point2f getPosition() {
        return kinetics.getPosition();
    }

    public float getHeading() {
        return kinetics.getHeading();
    }

    public KineticEntity getKinetics() {
        return kinetics;
    }

    @Override
    public String toString() {
        return "Projectile[" + handle + ", owner=" + ownerId + ", " + kinetics + "]";
    }
}
