package com.hellblazer.kinetica.simulation;

import com.hellblazer.kinetica.simulation.collision.Collidable;
import com.hellblazer.kinetica.simulation.entity.StringEntityID;
import com.hellblazer.kinetica.simulation.kinetics.KineticEntity;
import com.hellblazer.kinetica.simulation.steering.SteeringPilot;

import javax.vecmath.Point2f;
import java.util.Objects;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.requirePositive;

/**
 * A craft on the field. Its id doubles as the owner id of the shots it fires. Ships with a pilot steer themselves each
 * tick; ships without one are driven by the host.
 *
 * @author hal.hildebrand
 */
public class Ship implements Collidable {

    private final StringEntityID id;
    private final KineticEntity  kinetics;
    private final float          radius;
    private final SteeringPilot  pilot;
    private       int            hits;

    public Ship(StringEntityID id, KineticEntity kinetics, float radius, SteeringPilot pilot) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.kinetics = Objects.requireNonNull(kinetics, "kinetics cannot be null");
        this.radius = requirePositive(radius, "radius");
        this.pilot = pilot;
    }

    @Override
    public StringEntityID getId() {
        return id;
    }

    public String getOwnerId() {
        return id.getValue();
    }

    @Override
    public Point2f getPosition() {
        return kinetics.getPosition();
    }

    @Override
    public float getRadius() {
        return radius;
    }

    public KineticEntity getKinetics() {
        return kinetics;
    }

    /**
     * @return the autopilot, or null for a host-driven ship
     */
    public SteeringPilot getPilot() {
        return pilot;
    }

    public boolean isPiloted() {
        return pilot != null;
    }

    public int getHits() {
        return hits;
    }

    void recordHit() {
        hits++;
    }

    @Override
    public String toString() {
        return "Ship[" + id + ", hits=" + hits + ", " + kinetics + "]";
    }
}
