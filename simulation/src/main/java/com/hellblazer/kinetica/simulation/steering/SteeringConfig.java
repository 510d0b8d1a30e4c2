package com.hellblazer.kinetica.simulation.steering;

import static com.hellblazer.kinetica.common.InvalidConfigurationException.require;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requireNonNegative;
import static com.hellblazer.kinetica.common.InvalidConfigurationException.requirePositive;

/**
 * Tuning knobs of a {@link SteeringPilot}.
 *
 * @param seekWeight            scale of the unit vector toward the waypoint
 * @param avoidWeight           scale of the summed repulsion
 * @param dangerRadius          surface distance inside which a threat repels
 * @param arrivalTolerance      distance at which a waypoint counts as reached
 * @param turnRate              maximum heading change in radians per second
 * @param maxSteerForce         cap on the combined steering magnitude
 * @param waypointMargin        waypoints keep this far from the world edges
 * @param waypointCandidates    random candidates compared when choosing a waypoint
 * @param maneuverCooldownTicks ticks after a counted maneuver before another is counted
 * @author hal.hildebrand
 */
public record SteeringConfig(float seekWeight, float avoidWeight, float dangerRadius, float arrivalTolerance,
                             float turnRate, float maxSteerForce, float waypointMargin, int waypointCandidates,
                             int maneuverCooldownTicks) {

    public SteeringConfig {
        requireNonNegative(seekWeight, "seekWeight");
        requireNonNegative(avoidWeight, "avoidWeight");
        requirePositive(dangerRadius, "dangerRadius");
        requireNonNegative(arrivalTolerance, "arrivalTolerance");
        requirePositive(turnRate, "turnRate");
        requirePositive(maxSteerForce, "maxSteerForce");
        requireNonNegative(waypointMargin, "waypointMargin");
        require(waypointCandidates > 0, "waypointCandidates must be positive, was " + waypointCandidates);
        require(maneuverCooldownTicks >= 0, "maneuverCooldownTicks must be non-negative");
    }

    public static SteeringConfig defaults() {
        return new SteeringConfig(0.8f, 2.5f, 25.0f, 8.0f, 6.0f, 80.0f, 20.0f, 10, 15);
    }

    public SteeringConfig withSeekWeight(float seekWeight) {
        return new SteeringConfig(seekWeight, avoidWeight, dangerRadius, arrivalTolerance, turnRate, maxSteerForce,
                                  waypointMargin, waypointCandidates, maneuverCooldownTicks);
    }

    public SteeringConfig withAvoidWeight(float avoidWeight) {
        return new SteeringConfig(seekWeight, avoidWeight, dangerRadius, arrivalTolerance, turnRate, maxSteerForce,
                                  waypointMargin, waypointCandidates, maneuverCooldownTicks);
    }

    public SteeringConfig withDangerRadius(float dangerRadius) {
        return new SteeringConfig(seekWeight, avoidWeight, dangerRadius, arrivalTolerance, turnRate, maxSteerForce,
                                  waypointMargin, waypointCandidates, maneuverCooldownTicks);
    }

    public SteeringConfig withArrivalTolerance(float arrivalTolerance) {
        return new SteeringConfig(seekWeight, avoidWeight, dangerRadius, arrivalTolerance, turnRate, maxSteerForce,
                                  waypointMargin, waypointCandidates, maneuverCooldownTicks);
    }

    public SteeringConfig withTurnRate(float turnRate) {
        return new SteeringConfig(seekWeight, avoidWeight, dangerRadius, arrivalTolerance, turnRate, maxSteerForce,
                                  waypointMargin, waypointCandidates, maneuverCooldownTicks);
    }

    public SteeringConfig withManeuverCooldownTicks(int maneuverCooldownTicks) {
        return new SteeringConfig(seekWeight, avoidWeight, dangerRadius, arrivalTolerance, turnRate, maxSteerForce,
                                  waypointMargin, waypointCandidates, maneuverCooldownTicks);
    }
}
