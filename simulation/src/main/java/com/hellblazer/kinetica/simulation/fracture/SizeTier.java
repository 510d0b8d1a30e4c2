package com.hellblazer.kinetica.simulation.fracture;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.require;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requirePositive;

/**
 * One row of the size-tier table.
 *
 * @param tier       tier id, larger is bigger
 * @param radius     collision radius
 * @param health     damage a body of this tier absorbs before it breaks
 * @param points     score awarded for destroying it
 * @param childCount fragments produced on fracture; zero marks the terminal tier
 * @param childTier  tier of those fragments, ignored when terminal
 * @author hal.hildebrand
 */
public record SizeTier(int tier, float radius, float health, int points, int childCount, int childTier) {

    public SizeTier {
        require(tier > 0, "tier must be positive, was " + tier);
        requirePositive(radius, "radius of tier " + tier);
        requirePositive(health, "health of tier " + tier);
        require(points >= 0, "points of tier " + tier + " must be non-negative");
        require(childCount >= 0, "childCount of tier " + tier + " must be non-negative");
        require(childCount == 0 || childTier != tier, "tier " + tier + " cannot fracture into itself");
    }

    public static SizeTier terminal(int tier, float radius, float health, int points) {
        return new SizeTier(tier, radius, health, points, 0, 0);
    }

    public boolean isTerminal() {
        return childCount == 0;
    }
}
