package com.hellblazer.kinetica.simulation.kinetics;

import com.hellblazer.kinetica.common.InvalidConfigurationException;
import com.hellblazer.kinetica.geometry.DeterministicMath;
import com.hellblazer.kinetica.geometry.WorldBounds;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for KineticEntity - toroidal integration, thrust, damping and the speed cap.
 *
 * @author hal.hildebrand
 */
class KineticEntityTest {

    private static final float EPSILON = 1e-4f;

    private final WorldBounds bounds = new WorldBounds(160, 144);

    private static KineticProfile undamped() {
        return KineticProfile.ship().withDrag(1.0f);
    }

    @Test
    void testWrapsAcrossRightEdge() {
        var entity = new KineticEntity(KineticProfile.ship(), bounds, new Point2f(159.5f, 72.0f),
                                       new Vector2f(30.0f, 0.0f));
        entity.update(1.0f);

        var p = entity.getPosition();
        assertTrue(p.x >= 0.0f && p.x < 160.0f, "x=" + p.x);
        assertEquals(29.5f, p.x, EPSILON);
        assertEquals(72.0f, p.y, EPSILON, "orthogonal coordinate is preserved");
    }

    @Test
    void testWrapsAcrossLeftAndTopEdges() {
        var entity = new KineticEntity(undamped(), bounds, new Point2f(0.5f, 1.0f), new Vector2f(-30.0f, -11.0f));
        entity.update(1.0f);

        var p = entity.getPosition();
        assertEquals(130.5f, p.x, EPSILON);
        assertEquals(134.0f, p.y, EPSILON);
    }

    @Test
    void testPositionAlwaysWithinBounds() {
        var random = new Random(7);
        var entity = new KineticEntity(KineticProfile.ship().withMaxVelocity(500), bounds);
        for (int i = 0; i < 2_000; i++) {
            entity.setVelocity(new Vector2f(random.nextFloat() * 1000 - 500, random.nextFloat() * 1000 - 500));
            entity.update(random.nextFloat() * 2.0f);
            assertTrue(bounds.contains(entity.getPosition()), "escaped at step " + i + ": " + entity);
            assertTrue(entity.speed() <= 500.0f + EPSILON);
        }
    }

    @Test
    void testThrustAlongHeading() {
        var entity = new KineticEntity(KineticProfile.ship(), bounds);
        entity.setHeading((float) (Math.PI / 2));
        entity.applyThrust(1.0f, 0.1f);

        // thrustPower 120, mass 1
        var v = entity.getVelocity();
        assertEquals(0.0f, v.x, EPSILON);
        assertEquals(12.0f, v.y, EPSILON);
    }

    @Test
    void testThrustScalesWithMass() {
        var light = new KineticEntity(KineticProfile.ship(), bounds);
        var heavy = new KineticEntity(KineticProfile.ship().withMass(4.0f), bounds);
        light.applyThrust(0.5f, 0.1f);
        heavy.applyThrust(0.5f, 0.1f);
        assertEquals(light.speed() / 4.0f, heavy.speed(), EPSILON);
    }

    @Test
    void testSpeedNeverExceedsMaximum() {
        var entity = new KineticEntity(KineticProfile.ship(), bounds);
        for (int i = 0; i < 200; i++) {
            entity.applyThrust(1.0f, 0.1f);
            entity.update(0.1f);
            assertTrue(entity.speed() <= 120.0f + EPSILON, "speed=" + entity.speed());
        }
        entity.setVelocity(new Vector2f(1000, 1000));
        assertEquals(120.0f, entity.speed(), 1e-3f);
    }

    @Test
    void testPerTickDampingIgnoresStepSize() {
        var profile = KineticProfile.ship().withDrag(0.5f);
        var small = new KineticEntity(profile, bounds, new Point2f(10, 10), new Vector2f(10, 0));
        var large = new KineticEntity(profile, bounds, new Point2f(10, 10), new Vector2f(10, 0));
        small.update(0.01f);
        large.update(1.0f);

        assertEquals(5.0f, small.getVelocity().x, EPSILON);
        assertEquals(5.0f, large.getVelocity().x, EPSILON);
    }

    @Test
    void testExponentialDampingScalesWithStepSize() {
        var profile = KineticProfile.ship().withDrag(0.5f).withDampingMode(DampingMode.EXPONENTIAL);
        var oneTick = new KineticEntity(profile, bounds, new Point2f(10, 10), new Vector2f(10, 0));
        var twoTicks = new KineticEntity(profile, bounds, new Point2f(10, 10), new Vector2f(10, 0));
        oneTick.update(1.0f / 60.0f);
        twoTicks.update(2.0f / 60.0f);

        assertEquals(5.0f, oneTick.getVelocity().x, EPSILON);
        assertEquals(2.5f, twoTicks.getVelocity().x, EPSILON);
    }

    @Test
    void testDampingAppliesToAngularVelocity() {
        var entity = new KineticEntity(KineticProfile.ship().withDrag(0.5f), bounds);
        entity.setAngularVelocity(2.0f);
        entity.update(0.5f);

        assertEquals(1.0f, entity.getHeading(), EPSILON);
        assertEquals(1.0f, entity.getAngularVelocity(), EPSILON);
    }

    @Test
    void testSmallVelocitySnapsToZero() {
        var entity = new KineticEntity(undamped(), bounds, new Point2f(10, 10), new Vector2f(0.005f, 0.0f));
        entity.update(1.0f);
        assertEquals(0.0f, entity.speed());
    }

    @Test
    void testHeadingWraps() {
        var entity = new KineticEntity(KineticProfile.ship(), bounds);
        entity.applyRotation(1.0f, 10.0f);
        assertTrue(entity.getHeading() >= 0.0f && entity.getHeading() < DeterministicMath.TWO_PI);
        assertEquals(10.0f - DeterministicMath.TWO_PI, entity.getHeading(), EPSILON);

        entity.setHeading(-0.5f);
        assertEquals(DeterministicMath.TWO_PI - 0.5f, entity.getHeading(), EPSILON);
    }

    @Test
    void testStopAndDistance() {
        var a = new KineticEntity(KineticProfile.ship(), bounds, new Point2f(10, 10), new Vector2f(5, 5));
        var b = new KineticEntity(KineticProfile.ship(), bounds, new Point2f(13, 14), new Vector2f());
        assertEquals(5.0f, a.distanceTo(b), EPSILON);

        a.setAngularVelocity(1.0f);
        a.stop();
        assertEquals(0.0f, a.speed());
        assertEquals(0.0f, a.getAngularVelocity());
    }

    @Test
    void testSetPositionWraps() {
        var entity = new KineticEntity(KineticProfile.ship(), bounds);
        entity.setPosition(new Point2f(-10, 150));
        var p = entity.getPosition();
        assertEquals(150.0f, p.x, EPSILON);
        assertEquals(6.0f, p.y, EPSILON);
    }

    @Test
    void testInvalidProfileRejected() {
        assertThrows(InvalidConfigurationException.class, () -> KineticProfile.ship().withMass(0));
        assertThrows(InvalidConfigurationException.class, () -> KineticProfile.ship().withDrag(0));
        assertThrows(InvalidConfigurationException.class, () -> KineticProfile.ship().withDrag(1.5f));
        assertThrows(InvalidConfigurationException.class, () -> KineticProfile.ship().withMaxVelocity(-1));
        assertThrows(InvalidConfigurationException.class, () -> KineticProfile.ship().withDampingMode(null));
    }
}
