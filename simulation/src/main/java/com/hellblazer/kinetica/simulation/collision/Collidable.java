package com.hellblazer.kinetica.simulation.collision;

import com.hellblazer.kinetica.simulation.entity.EntityID;

import javax.vecmath.Point2f;

/**
 * A body the broad-phase can test: a circle at a position.
 *
 * @author hal.hildebrand
 */
public interface Collidable {

    EntityID getId();

    Point2f getPosition();

    float getRadius();
}
