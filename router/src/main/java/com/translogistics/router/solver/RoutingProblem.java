package com.translogistics.router.solver;

import lombok.Value;

/**
 * Integer-scaled routing problem. Node 0 is the depot.
 */
@Value
public class RoutingProblem {
    public static final int DEPOT = 0;
    public static final int VEHICLE_COUNT = 1;
    public static final long HORIZON_SECONDS = 24 * 60 * 60;
    public static final int DEMAND_SCALE = 100;

    long[][] distanceMeters;
    long[][] travelSeconds;
    long[] serviceSeconds;
    long[] demands;
    long vehicleCapacity;

    public int nodeCount() {
        return distanceMeters.length;
    }
}
