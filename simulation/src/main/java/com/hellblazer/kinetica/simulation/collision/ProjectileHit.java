package com.hellblazer.kinetica.simulation.collision;

import com.hellblazer.kinetica.simulation.fracture.AsteroidFragment;
import com.hellblazer.kinetica.simulation.projectile.Projectile;

/**
 * A shot overlapping an asteroid.
 *
 * @param projectile the shot
 * @param asteroid   the asteroid it struck
 * @param distance   center distance at detection
 */
public record ProjectileHit(Projectile projectile, AsteroidFragment asteroid, float distance) {

    /**
     * Direction the shot was travelling, used to orient the fragment scatter.
     */
    public float impactAngle() {
        return projectile.getHeading();
    }
}
