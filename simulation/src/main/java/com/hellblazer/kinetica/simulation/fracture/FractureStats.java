package com.hellblazer.kinetica.simulation.fracture;

/**
 * @param fractured        bodies broken apart, terminal tiers included
 * @param fragmentsCreated fragments produced by fracturing
 * @param spawned          asteroids created for initial fields and waves
 */
public record FractureStats(long fractured, long fragmentsCreated, long spawned) {
}
