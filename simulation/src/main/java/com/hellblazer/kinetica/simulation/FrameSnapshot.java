package com.hellblazer.kinetica.simulation;

import java.util.List;

/**
 * State of the field after a tick completes: ships, then asteroids, then shots, each in insertion order.
 *
 * @param tick      ticks run so far
 * @param time      simulation seconds elapsed
 * @param wave      current wave number, zero before the first wave
 * @param entities  body views
 * @param telemetry counters of the last tick
 */
public record FrameSnapshot(long tick, double time, int wave, List<EntityView> entities, TickTelemetry telemetry) {

    public FrameSnapshot {
        entities = List.copyOf(entities);
    }

    public List<EntityView> of(EntityKind kind) {
        return entities.stream().filter(e -> e.kind() == kind).toList();
    }
}
