package com.hellblazer.kinetica.simulation.steering;

import com.hellblazer.kinetica.geometry.DeterministicMath;
import com.hellblazer.kinetica.geometry.WorldBounds;
import com.hellblazer.kinetica.simulation.kinetics.KineticEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Seek-and-avoid autopilot for one craft.
 * <p>
 * The control law and its application are separate steps. {@link #computeSteering} turns the craft's position and the
 * threats around it into a steering vector without touching the craft; {@link #applyToShip} turns that vector into a
 * bounded heading change and forward thrust. A host computes steering for every craft before applying any of it.
 * <p>
 * Steering is the sum of two terms. Seek is the unit vector toward the current waypoint, scaled by the seek weight.
 * Avoid sums, over each threat whose surface lies within the danger radius, the unit vector away from it divided by
 * that surface distance, scaled by the avoid weight. All distances are measured the short way around the torus.
 *
 * @author hal.hildebrand
 */
public class SteeringPilot {

    /**
     * Floor on surface distance; overlapping threats repel at this strength instead of dividing by zero.
     */
    public static final float MIN_SURFACE_DISTANCE = 0.1f;

    /**
     * Steering magnitudes at or below this leave the craft coasting.
     */
    public static final float STEERING_DEADZONE = 1e-4f;

    private static final Logger log = LoggerFactory.getLogger(SteeringPilot.class);

    private final SteeringConfig config;
    private final Random         random;
    private final SurvivalLog    survivalLog;
    private       Point2f        waypoint;

    public SteeringPilot(SteeringConfig config, Random random) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        this.survivalLog = new SurvivalLog(config.maneuverCooldownTicks());
    }

    /**
     * Compute this tick's steering vector for {@code ship}. Picks a new waypoint when there is none or the current one
     * has been reached, and records telemetry; the ship itself is not modified.
     */
    public Vector2f computeSteering(KineticEntity ship, List<Threat> threats, WorldBounds bounds) {
        var position = ship.getPosition();

        if (waypoint == null) {
            waypoint = selectWaypoint(threats, bounds);
        }
        var toWaypoint = bounds.shortestVector(position, waypoint);
        if (DeterministicMath.length(toWaypoint) <= config.arrivalTolerance()) {
            survivalLog.recordWaypointReached();
            waypoint = selectWaypoint(threats, bounds);
            log.trace("Waypoint reached, next {}", waypoint);
            toWaypoint = bounds.shortestVector(position, waypoint);
        }

        var seek = normalized(toWaypoint);
        seek.scale(config.seekWeight());

        var avoid = avoid(ship, position, threats, bounds);
        avoid.scale(config.avoidWeight());

        var steering = new Vector2f(seek);
        steering.add(avoid);
        float magnitude = DeterministicMath.length(steering);
        if (magnitude > config.maxSteerForce()) {
            steering.scale(config.maxSteerForce() / magnitude);
            magnitude = config.maxSteerForce();
        }
        survivalLog.tick(magnitude);
        return steering;
    }

    /**
     * Turn {@code ship} toward the steering direction by at most {@code turnRate · dt}, then thrust forward with
     * throttle {@code min(|steering|, 1)}. A zero steering vector leaves the ship coasting.
     */
    public void applyToShip(Vector2f steering, KineticEntity ship, float dt) {
        float magnitude = DeterministicMath.length(steering);
        if (magnitude <= STEERING_DEADZONE) {
            return;
        }
        float desired = DeterministicMath.atan2(steering.y, steering.x);
        float diff = DeterministicMath.angleDelta(ship.getHeading(), desired);
        float maxTurn = config.turnRate() * dt;
        if (Math.abs(diff) <= maxTurn) {
            ship.setHeading(desired);
        } else {
            ship.setHeading(ship.getHeading() + Math.copySign(maxTurn, diff));
        }
        ship.applyThrust(Math.min(magnitude, 1.0f), dt);
    }

    public Point2f getWaypoint() {
        return waypoint == null ? null : new Point2f(waypoint);
    }

    public void setWaypoint(Point2f waypoint) {
        this.waypoint = waypoint == null ? null : new Point2f(waypoint);
    }

    public SurvivalLog getSurvivalLog() {
        return survivalLog;
    }

    public SteeringConfig getConfig() {
        return config;
    }

    /**
     * Forget the waypoint and clear telemetry.
     */
    public void reset() {
        waypoint = null;
        survivalLog.reset();
    }

    private Vector2f avoid(KineticEntity ship, Point2f position, List<Threat> threats, WorldBounds bounds) {
        if (threats.isEmpty()) {
            return new Vector2f();
        }
        float nearest = Float.POSITIVE_INFINITY;
        List<Vector2f> repulsions = new ArrayList<>();
        for (var threat : threats) {
            var toThreat = bounds.shortestVector(position, threat.position());
            float centerDistance = DeterministicMath.length(toThreat);
            float surface = Math.max(centerDistance - threat.radius(), MIN_SURFACE_DISTANCE);
            nearest = Math.min(nearest, surface);
            if (surface >= config.dangerRadius()) {
                continue;
            }
            Vector2f away;
            if (centerDistance > 0.0f) {
                away = new Vector2f(-toThreat.x / centerDistance, -toThreat.y / centerDistance);
            } else {
                // Dead center: back off along the reverse heading
                away = ship.forward();
                away.negate();
            }
            away.scale(1.0f / surface);
            repulsions.add(away);
        }
        survivalLog.recordThreatDistance(nearest);
        if (!repulsions.isEmpty()) {
            survivalLog.recordManeuver();
        }
        return DeterministicMath.stableSumVectors(repulsions.toArray(new Vector2f[0]));
    }

    private Point2f selectWaypoint(List<Threat> threats, WorldBounds bounds) {
        float margin = config.waypointMargin();
        float maxX = Math.max(margin, bounds.width() - margin);
        float maxY = Math.max(margin, bounds.height() - margin);

        Point2f best = null;
        float bestClearance = -1.0f;
        for (int i = 0; i < config.waypointCandidates(); i++) {
            var candidate = new Point2f(margin + random.nextFloat() * (maxX - margin),
                                        margin + random.nextFloat() * (maxY - margin));
            float clearance = Float.POSITIVE_INFINITY;
            for (var threat : threats) {
                clearance = Math.min(clearance, bounds.toroidalDistance(candidate, threat.position()));
            }
            if (clearance > bestClearance) {
                bestClearance = clearance;
                best = candidate;
            }
        }
        return best == null ? bounds.center() : bounds.wrap(best);
    }

    private static Vector2f normalized(Vector2f v) {
        float length = DeterministicMath.length(v);
        if (length <= 0.0f) {
            return new Vector2f();
        }
        return new Vector2f(v.x / length, v.y / length);
    }
}
