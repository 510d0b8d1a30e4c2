package com.hellblazer.kinetica.simulation.projectile;

/**
 * Lifetime counters of a {@link ProjectileSystem}.
 *
 * @param fired    shots that left the pool
 * @param rejected fire attempts refused by cooldown or an empty pool
 * @param expired  shots recycled because their lifetime ran out
 * @param recycled shots returned to the pool for any reason
 * @param active   shots currently in flight
 * @param pooled   slots currently available
 */
public record ProjectileStats(long fired, long rejected, long expired, long recycled, int active, int pooled) {

    public int capacity() {
        return active + pooled;
    }
}
