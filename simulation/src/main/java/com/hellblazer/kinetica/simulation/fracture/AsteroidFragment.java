package com.hellblazer.kinetica.simulation.fracture;

import com.hellblazer.kinetica.simulation.collision.Collidable;
import com.hellblazer.kinetica.simulation.entity.LongEntityID;
import com.hellblazer.kinetica.simulation.kinetics.KineticEntity;

import javax.vecmath.Point2f;
import java.util.Objects;

/**
 * A destructible body of one size tier. Created by {@link FractureSystem}, owned by whoever holds it.
 *
 * @author hal.hildebrand
 */
public class AsteroidFragment implements Collidable {

    private final LongEntityID  id;
    private final KineticEntity kinetics;
    private final SizeTier      tier;
    private       float         health;

    public AsteroidFragment(LongEntityID id, KineticEntity kinetics, SizeTier tier) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.kinetics = Objects.requireNonNull(kinetics, "kinetics cannot be null");
        this.tier = Objects.requireNonNull(tier, "tier cannot be null");
        this.health = tier.health();
    }

    /**
     * Reduce health by {@code damage}.
     *
     * @return true when health has reached zero
     */
    public boolean takeDamage(float damage) {
        health -= damage;
        return health <= 0.0f;
    }

    public boolean isDestroyed() {
        return health <= 0.0f;
    }

    @Override
    public LongEntityID getId() {
        return id;
    }

    @Override
    public Point2f getPosition() {
        return kinetics.getPosition();
    }

    @Override
    public float getRadius() {
        return tier.radius();
    }

    public KineticEntity getKinetics() {
        return kinetics;
    }

    public SizeTier getTier() {
        return tier;
    }

    public int getSize() {
        return tier.tier();
    }

    public float getHealth() {
        return health;
    }

    public int getPoints() {
        return tier.points();
    }

    @Override
    public String toString() {
        return "Asteroid[" + id + ", tier=" + tier.tier() + ", hp=" + health + ", " + kinetics + "]";
    }
}
