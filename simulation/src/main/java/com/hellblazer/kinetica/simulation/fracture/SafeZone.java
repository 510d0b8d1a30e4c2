package com.hellblazer.kinetica.simulation.fracture;

import com.hellblazer.kinetica.geometry.DeterministicMath;

import javax.vecmath.Point2f;
import java.util.Objects;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.requireNonNegative;

/**
 * Circle new asteroids must not spawn in, typically centered on the player's ship.
 *
 * @author hal.hildebrand
 */
public record SafeZone(Point2f center, float radius) {

    public SafeZone {
        center = new Point2f(Objects.requireNonNull(center, "center cannot be null"));
        requireNonNegative(radius, "radius");
    }

    public SafeZone(float x, float y, float radius) {
        this(new Point2f(x, y), radius);
    }

    @Override
    public Point2f center() {
        return new Point2f(center);
    }

    /**
     * @return true when {@code p} is farther than {@code radius + padding} from the center
     */
    public boolean isClear(Point2f p, float padding) {
        return DeterministicMath.distance(center, p) > radius + padding;
    }
}
