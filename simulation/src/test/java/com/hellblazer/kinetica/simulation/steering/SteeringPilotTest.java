package com.hellblazer.kinetica.simulation.steering;

import com.hellblazer.kinetica.common.InvalidConfigurationException;
import com.hellblazer.kinetica.geometry.DeterministicMath;
import com.hellblazer.kinetica.geometry.WorldBounds;
import com.hellblazer.kinetica.simulation.kinetics.KineticEntity;
import com.hellblazer.kinetica.simulation.kinetics.KineticProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SteeringPilot - seek, avoidance, waypoint handling, turn limits and survival telemetry.
 *
 * @author hal.hildebrand
 */
class SteeringPilotTest {

    private WorldBounds bounds;
    private Random      random;

    @BeforeEach
    void setUp() {
        bounds = new WorldBounds(160, 144);
        random = new Random(3);
    }

    private KineticEntity craftAt(float x, float y) {
        return new KineticEntity(KineticProfile.ship(), bounds, new Point2f(x, y), new Vector2f());
    }

    @Test
    void testSeekOnly() {
        var pilot = new SteeringPilot(SteeringConfig.defaults().withAvoidWeight(0.0f), random);
        pilot.setWaypoint(new Point2f(100, 72));

        var steering = pilot.computeSteering(craftAt(80, 72), List.of(new Threat(90, 72, 2)), bounds);

        assertEquals(0.8f, steering.x, 1e-5f);
        assertEquals(0.0f, steering.y, 1e-5f);
    }

    @Test
    void testSeekTakesShortWayAround() {
        var pilot = new SteeringPilot(SteeringConfig.defaults(), random);
        pilot.setWaypoint(new Point2f(155, 72));

        var steering = pilot.computeSteering(craftAt(5, 72), List.of(), bounds);

        assertTrue(steering.x < 0.0f, "expected to cross the left edge, got " + steering);
    }

    @Test
    void testAvoidanceDominatesSeek() {
        var config = SteeringConfig.defaults().withSeekWeight(1.0f).withAvoidWeight(50.0f);
        var pilot = new SteeringPilot(config, random);
        pilot.setWaypoint(new Point2f(130, 72));

        var steering = pilot.computeSteering(craftAt(80, 72), List.of(new Threat(90, 72, 2)), bounds);

        // seek (1, 0) plus 50 * (-1, 0) / 8
        assertEquals(1.0f - 50.0f / 8.0f, steering.x, 1e-4f);
        assertEquals(0.0f, steering.y, 1e-5f);
        assertEquals(8.0f, pilot.getSurvivalLog().getClosestCall(), 1e-5f);
        assertEquals(1, pilot.getSurvivalLog().getAvoidanceManeuvers());
    }

    @Test
    void testDistantThreatIgnored() {
        var pilot = new SteeringPilot(SteeringConfig.defaults().withSeekWeight(0.0f), random);
        pilot.setWaypoint(new Point2f(130, 72));

        var steering = pilot.computeSteering(craftAt(20, 20), List.of(new Threat(80, 80, 4)), bounds);

        assertEquals(0.0f, DeterministicMath.length(steering), 1e-6f);
        assertEquals(0, pilot.getSurvivalLog().getAvoidanceManeuvers());
        assertTrue(pilot.getSurvivalLog().getClosestCall() > 25.0f);
    }

    @Test
    void testSteeringIsCapped() {
        var pilot = new SteeringPilot(SteeringConfig.defaults().withAvoidWeight(50.0f), random);
        pilot.setWaypoint(new Point2f(130, 72));

        var steering = pilot.computeSteering(craftAt(80, 72), List.of(new Threat(80.5f, 72, 2)), bounds);

        assertEquals(80.0f, DeterministicMath.length(steering), 1e-3f);
        assertEquals(SteeringPilot.MIN_SURFACE_DISTANCE, pilot.getSurvivalLog().getClosestCall());
    }

    @Test
    void testWaypointSelectedWhenMissing() {
        var pilot = new SteeringPilot(SteeringConfig.defaults(), random);
        assertNull(pilot.getWaypoint());

        pilot.computeSteering(craftAt(80, 72), List.of(), bounds);

        var waypoint = pilot.getWaypoint();
        assertNotNull(waypoint);
        assertTrue(waypoint.x >= 20.0f && waypoint.x <= 140.0f);
        assertTrue(waypoint.y >= 20.0f && waypoint.y <= 124.0f);
    }

    @Test
    void testWaypointReached() {
        var pilot = new SteeringPilot(SteeringConfig.defaults(), random);
        var reached = new Point2f(83, 72);
        pilot.setWaypoint(reached);

        pilot.computeSteering(craftAt(80, 72), List.of(), bounds);

        assertEquals(1, pilot.getSurvivalLog().getWaypointsReached());
        assertNotNull(pilot.getWaypoint());
        assertNotEquals(reached, pilot.getWaypoint());
    }

    @Test
    void testManeuversRespectCooldown() {
        var pilot = new SteeringPilot(SteeringConfig.defaults().withManeuverCooldownTicks(15), random);
        pilot.setWaypoint(new Point2f(130, 72));
        var craft = craftAt(80, 72);
        var threats = List.of(new Threat(90, 72, 2));

        for (int i = 0; i < 30; i++) {
            pilot.computeSteering(craft, threats, bounds);
        }
        var log = pilot.getSurvivalLog();
        assertEquals(2, log.getAvoidanceManeuvers());
        assertEquals(30, log.getTicksObserved());

        pilot.computeSteering(craft, threats, bounds);
        assertEquals(3, log.getAvoidanceManeuvers());
    }

    @Test
    void testClosestCallOnlyDecreases() {
        var pilot = new SteeringPilot(SteeringConfig.defaults(), random);
        pilot.setWaypoint(new Point2f(130, 20));
        var craft = craftAt(80, 72);

        pilot.computeSteering(craft, List.of(new Threat(100, 72, 2)), bounds);
        assertEquals(18.0f, pilot.getSurvivalLog().getClosestCall(), 1e-4f);
        pilot.computeSteering(craft, List.of(new Threat(90, 72, 2)), bounds);
        assertEquals(8.0f, pilot.getSurvivalLog().getClosestCall(), 1e-4f);
        pilot.computeSteering(craft, List.of(new Threat(95, 72, 2)), bounds);
        assertEquals(8.0f, pilot.getSurvivalLog().getClosestCall(), 1e-4f);

        pilot.reset();
        assertEquals(Float.POSITIVE_INFINITY, pilot.getSurvivalLog().getClosestCall());
        assertNull(pilot.getWaypoint());
    }

    @Test
    void testTurnIsRateLimited() {
        var pilot = new SteeringPilot(SteeringConfig.defaults(), random);
        var craft = craftAt(80, 72);

        pilot.applyToShip(new Vector2f(0, 1), craft, 0.1f);

        assertEquals(0.6f, craft.getHeading(), 1e-5f);
        assertTrue(craft.getVelocity().y > 0.0f);
    }

    @Test
    void testSmallTurnSnapsToDesired() {
        var pilot = new SteeringPilot(SteeringConfig.defaults(), random);
        var craft = craftAt(80, 72);

        pilot.applyToShip(new Vector2f(1.0f, 0.1f), craft, 0.1f);

        assertEquals(DeterministicMath.atan2(0.1f, 1.0f), craft.getHeading(), 1e-6f);
    }

    @Test
    void testTurnWrapsBelowZero() {
        var pilot = new SteeringPilot(SteeringConfig.defaults(), random);
        var craft = craftAt(80, 72);
        craft.setHeading(0.1f);

        pilot.applyToShip(new Vector2f(0, -1), craft, 0.1f);

        assertEquals(DeterministicMath.TWO_PI - 0.5f, craft.getHeading(), 1e-5f);
    }

    @Test
    void testZeroSteeringCoasts() {
        var pilot = new SteeringPilot(SteeringConfig.defaults(), random);
        var craft = craftAt(80, 72);
        craft.setHeading(1.0f);
        craft.setVelocity(new Vector2f(3, 4));

        pilot.applyToShip(new Vector2f(), craft, 0.1f);

        assertEquals(1.0f, craft.getHeading());
        assertEquals(new Vector2f(3, 4), craft.getVelocity());
    }

    @Test
    void testThrottleIsCapped() {
        var pilot = new SteeringPilot(SteeringConfig.defaults(), random);
        var craft = craftAt(80, 72);

        pilot.applyToShip(new Vector2f(40, 0), craft, 0.1f);

        // Full throttle: thrustPower / mass * dt
        assertEquals(12.0f, craft.getVelocity().x, 1e-4f);
    }

    @Test
    void testInvalidConfig() {
        assertThrows(InvalidConfigurationException.class, () -> SteeringConfig.defaults().withSeekWeight(-1.0f));
        assertThrows(InvalidConfigurationException.class, () -> SteeringConfig.defaults().withDangerRadius(0.0f));
        assertThrows(InvalidConfigurationException.class, () -> SteeringConfig.defaults().withTurnRate(Float.NaN));
        assertThrows(InvalidConfigurationException.class,
                     () -> SteeringConfig.defaults().withManeuverCooldownTicks(-1));
        assertThrows(InvalidConfigurationException.class, () -> new Threat(0, 0, -1));
    }
}
