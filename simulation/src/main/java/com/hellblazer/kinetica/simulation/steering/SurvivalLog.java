package com.hellblazer.kinetica.simulation.steering;

/**
 * Telemetry of one pilot's run.
 * <p>
 * Avoidance maneuvers are counted at most once per cooldown window, however long a threat stays close. The closest
 * call only ever decreases.
 *
 * @author hal.hildebrand
 */
public class SurvivalLog {

    private final int cooldownTicks;

    private long   ticksObserved;
    private int    avoidanceManeuvers;
    private float  closestCall = Float.POSITIVE_INFINITY;
    private int    waypointsReached;
    private double totalSteeringMagnitude;
    private int    maneuverCooldown;

    public SurvivalLog(int cooldownTicks) {
        this.cooldownTicks = cooldownTicks;
    }

    void recordManeuver() {
        if (maneuverCooldown == 0) {
            avoidanceManeuvers++;
            maneuverCooldown = cooldownTicks;
        }
    }

    void recordThreatDistance(float distance) {
        if (distance < closestCall) {
            closestCall = distance;
        }
    }

    void recordWaypointReached() {
        waypointsReached++;
    }

    void tick(float steeringMagnitude) {
        ticksObserved++;
        totalSteeringMagnitude += steeringMagnitude;
        if (maneuverCooldown > 0) {
            maneuverCooldown--;
        }
    }

    void reset() {
        ticksObserved = 0;
        avoidanceManeuvers = 0;
        closestCall = Float.POSITIVE_INFINITY;
        waypointsReached = 0;
        totalSteeringMagnitude = 0.0;
        maneuverCooldown = 0;
    }

    public long getTicksObserved() {
        return ticksObserved;
    }

    public int getAvoidanceManeuvers() {
        return avoidanceManeuvers;
    }

    /**
     * Smallest surface distance to any threat seen so far; infinite until a threat is seen.
     */
    public float getClosestCall() {
        return closestCall;
    }

    public int getWaypointsReached() {
        return waypointsReached;
    }

    public double getAverageSteering() {
        return ticksObserved == 0 ? 0.0 : totalSteeringMagnitude / ticksObserved;
    }

    @Override
    public String toString() {
        return String.format("SurvivalLog[ticks=%d, maneuvers=%d, closestCall=%.2f, waypoints=%d, avgSteering=%.3f]",
                             ticksObserved, avoidanceManeuvers, closestCall, waypointsReached, getAverageSteering());
    }
}
