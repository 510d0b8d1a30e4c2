package com.hellblazer.kinetica.simulation.collision;

/**
 * Broad-phase counters.
 *
 * @param pairsTested    circle pairs tested
 * @param shipHits       ship contacts reported
 * @param projectileHits projectile contacts reported
 * @author hal.hildebrand
 */
public record CollisionStats(long pairsTested, long shipHits, long projectileHits) {

    public static final CollisionStats EMPTY = new CollisionStats(0, 0, 0);

    public CollisionStats plus(CollisionStats other) {
        return new CollisionStats(pairsTested + other.pairsTested, shipHits + other.shipHits,
                                  projectileHits + other.projectileHits);
    }

    public double hitRate() {
        return pairsTested == 0 ? 0.0 : (double) (shipHits + projectileHits) / pairsTested;
    }

    @Override
    public String toString() {
        return String.format("CollisionStats[pairs=%d, shipHits=%d, projectileHits=%d, hitRate=%.2f%%]", pairsTested,
                             shipHits, projectileHits, hitRate() * 100);
    }
}
