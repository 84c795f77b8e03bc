package com.translogistics.router.algorithm;

import lombok.Value;

/**
 * Per-call parameters resolved from the request and the configured defaults.
 */
@Value
public class RouteContext {
    double depotLatitude;
    double depotLongitude;
    double capacityKg;
    int maxStops;
    double averageSpeedKmh;
    double stopDurationMinutes;
    boolean returnToDepot;

    public double travelMinutes(double distanceKm) {
        return distanceKm / averageSpeedKmh * 60;
    }
}
