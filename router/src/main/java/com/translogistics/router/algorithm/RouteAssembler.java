package com.translogistics.router.algorithm;

import com.translogistics.router.dto.OptimizedRoute;
import com.translogistics.router.dto.OptimizedStop;
import com.translogistics.router.dto.Stop;
import com.translogistics.router.util.NavigationLinkBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a visiting order into the final route: sequence numbers, leg distances,
 * cumulative arrival estimates and totals including the optional return leg.
 */
public class RouteAssembler {

    public OptimizedRoute assemble(RouteContext context, StopOrdering ordering,
                                   List<String> warnings, List<String> stopsSkipped) {
        List<OptimizedStop> orderedStops = new ArrayList<>(ordering.getStops().size());

        double previousLat = context.getDepotLatitude();
        double previousLng = context.getDepotLongitude();
        double totalDistance = 0.0;
        double cumulativeMinutes = 0.0;

        int sequence = 0;
        for (Stop stop : ordering.getStops()) {
            double legKm = DistanceModel.haversineKm(previousLat, previousLng,
                    stop.getLatitude(), stop.getLongitude());
            totalDistance += legKm;
            cumulativeMinutes += context.travelMinutes(legKm) + context.getStopDurationMinutes();

            orderedStops.add(OptimizedStop.builder()
                    .id(stop.getId())
                    .name(stop.getName())
                    .sequence(sequence++)
                    .latitude(stop.getLatitude())
                    .longitude(stop.getLongitude())
                    .distanceFromPreviousKm(roundKm(legKm))
                    .estimatedArrivalMinutes(Math.round(cumulativeMinutes))
                    .demandKg(stop.getDemandKg())
                    .locationQuality(stop.getLocationQuality())
                    .navigation(NavigationLinkBuilder.forCoordinates(stop.getLatitude(), stop.getLongitude()))
                    .build());

            previousLat = stop.getLatitude();
            previousLng = stop.getLongitude();
        }

        if (context.isReturnToDepot() && !orderedStops.isEmpty()) {
            double returnKm = DistanceModel.haversineKm(previousLat, previousLng,
                    context.getDepotLatitude(), context.getDepotLongitude());
            totalDistance += returnKm;
            cumulativeMinutes += context.travelMinutes(returnKm);
        }

        return OptimizedRoute.builder()
                .orderedStops(orderedStops)
                .totalDistanceKm(roundKm(totalDistance))
                .estimatedDurationMinutes(Math.round(cumulativeMinutes))
                .warnings(warnings)
                .stopsSkipped(stopsSkipped)
                .optimizationMethod(ordering.getMethod())
                .build();
    }

    public static double roundKm(double km) {
        return Math.round(km * 100) / 100.0;
    }
}
