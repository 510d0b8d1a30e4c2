package com.hellblazer.kinetica.simulation.kinetics;

import com.hellblazer.kinetica.geometry.DeterministicMath;
import com.hellblazer.kinetica.geometry.WorldBounds;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;
import java.util.Objects;

/**
 * Rigid-body state of one simulated body on a toroidal world: position, velocity, heading and angular velocity.
 * <p>
 * After every {@link #update(float)} the position lies within the world bounds and the speed does not exceed
 * {@link KineticProfile#maxVelocity()}. Each projectile, fragment and ship owns exactly one instance.
 *
 * @author hal.hildebrand
 */
public class KineticEntity {

    /**
     * Speeds below this snap to zero so damped bodies come to rest instead of drifting forever.
     */
    public static final float VELOCITY_EPSILON = 0.01f;

    private final Point2f     position        = new Point2f();
    private final Vector2f    velocity        = new Vector2f();
    private final WorldBounds bounds;
    private       KineticProfile profile;
    private       float       heading;
    private       float       angularVelocity;

    public KineticEntity(KineticProfile profile, WorldBounds bounds) {
        this.profile = Objects.requireNonNull(profile, "profile cannot be null");
        this.bounds = Objects.requireNonNull(bounds, "bounds cannot be null");
    }

    public KineticEntity(KineticProfile profile, WorldBounds bounds, Point2f position, Vector2f velocity) {
        this(profile, bounds);
        setPosition(position);
        setVelocity(velocity);
    }

    /**
     * Accelerate along the current heading by {@code magnitude · thrustPower / mass · dt}, then clamp to the speed cap.
     *
     * @param magnitude throttle, usually in [0, 1]
     */
    public void applyThrust(float magnitude, float dt) {
        float accel = magnitude * profile.thrustPower() / profile.mass();
        velocity.x += DeterministicMath.cos(heading) * accel * dt;
        velocity.y += DeterministicMath.sin(heading) * accel * dt;
        clampSpeed();
    }

    /**
     * Turn by {@code rate · dt} radians.
     */
    public void applyRotation(float rate, float dt) {
        setHeading(heading + rate * dt);
    }

    /**
     * Integrate one step: move, wrap each axis, spin, damp, snap and clamp.
     */
    public void update(float dt) {
        position.x += velocity.x * dt;
        position.y += velocity.y * dt;
        bounds.wrap(position);

        heading = DeterministicMath.wrapAngle(heading + angularVelocity * dt);

        float factor = dampingFactor(dt);
        velocity.scale(factor);
        angularVelocity *= factor;

        if (velocity.lengthSquared() < VELOCITY_EPSILON * VELOCITY_EPSILON) {
            velocity.set(0.0f, 0.0f);
        }
        clampSpeed();
    }

    public void stop() {
        velocity.set(0.0f, 0.0f);
        angularVelocity = 0.0f;
    }

    public float distanceTo(KineticEntity other) {
        return DeterministicMath.distance(position, other.position);
    }

    public float speed() {
        return DeterministicMath.length(velocity);
    }

    /**
     * Unit vector along the current heading.
     */
    public Vector2f forward() {
        return DeterministicMath.unit(heading);
    }

    public Point2f getPosition() {
        return new Point2f(position);
    }

    /**
     * Place the body, wrapping into the world.
     */
    public void setPosition(Point2f p) {
        position.set(p);
        bounds.wrap(position);
    }

    public Vector2f getVelocity() {
        return new Vector2f(velocity);
    }

    /**
     * Set the velocity, clamped to the speed cap.
     */
    public void setVelocity(Vector2f v) {
        velocity.set(v);
        clampSpeed();
    }

    public float getHeading() {
        return heading;
    }

    public void setHeading(float angle) {
        heading = DeterministicMath.wrapAngle(angle);
    }

    public float getAngularVelocity() {
        return angularVelocity;
    }

    public void setAngularVelocity(float angularVelocity) {
        this.angularVelocity = angularVelocity;
    }

    public KineticProfile getProfile() {
        return profile;
    }

    /**
     * Swap physical constants. Used when a pooled body is reconfigured for its next life.
     */
    public void setProfile(KineticProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile cannot be null");
        clampSpeed();
    }

    public WorldBounds getBounds() {
        return bounds;
    }

    private float dampingFactor(float dt) {
        float drag = profile.drag();
        if (drag >= 1.0f) {
            return 1.0f;
        }
        return switch (profile.dampingMode()) {
            case PER_TICK -> drag;
            case EXPONENTIAL -> DeterministicMath.pow(drag, dt * profile.referenceRate());
        };
    }

    private void clampSpeed() {
        float max = profile.maxVelocity();
        float speedSquared = velocity.lengthSquared();
        if (speedSquared > max * max) {
            velocity.scale(max / DeterministicMath.sqrt(speedSquared));
        }
    }

    @Override
    public String toString() {
        return String.format("KineticEntity[pos=(%.2f,%.2f), vel=(%.2f,%.2f), heading=%.3f]", position.x, position.y,
                             velocity.x, velocity.y, heading);
    }
}
