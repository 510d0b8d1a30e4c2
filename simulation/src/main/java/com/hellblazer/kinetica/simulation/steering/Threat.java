package com.hellblazer.kinetica.simulation.steering;

import com.hellblazer.kinetica.simulation.collision.Collidable;

import javax.vecmath.Point2f;
import java.util.Objects;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.requireNonNegative;

/**
 * Something a pilot steers clear of: a circle frozen at the position it had when the tick began.
 */
public record Threat(Point2f position, float radius) {

    public Threat {
        position = new Point2f(Objects.requireNonNull(position, "position cannot be null"));
        requireNonNegative(radius, "radius");
    }

    public Threat(float x, float y, float radius) {
        this(new Point2f(x, y), radius);
    }

    public static Threat of(Collidable body) {
        return new Threat(body.getPosition(), body.getRadius());
    }

    @Override
    public Point2f position() {
        return new Point2f(position);
    }
}
