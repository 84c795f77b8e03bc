package com.translogistics.router.algorithm;

import com.translogistics.router.dto.Stop;
import com.translogistics.router.model.OptimizationMethod;

import java.util.ArrayList;
import java.util.List;

/**
 * Nearest-neighbor tour construction from the depot. Deterministic: on an exact
 * distance tie the stop that comes first in the input wins.
 */
public class HeuristicSolver {

    public StopOrdering solve(double depotLat, double depotLng, List<Stop> stops) {
        List<Stop> remaining = new ArrayList<>(stops);
        List<Stop> sorted = new ArrayList<>(stops.size());

        double currentLat = depotLat;
        double currentLng = depotLng;

        while (!remaining.isEmpty()) {
            int nearestIndex = findNearestIndex(currentLat, currentLng, remaining);
            Stop nearest = remaining.remove(nearestIndex);
            sorted.add(nearest);
            currentLat = nearest.getLatitude();
            currentLng = nearest.getLongitude();
        }

        return new StopOrdering(sorted, OptimizationMethod.HEURISTIC);
    }

    private int findNearestIndex(double lat, double lng, List<Stop> candidates) {
        int nearestIndex = 0;
        double minDistance = Double.MAX_VALUE;

        for (int i = 0; i < candidates.size(); i++) {
            Stop candidate = candidates.get(i);
            double distance = DistanceModel.haversineKm(lat, lng,
                    candidate.getLatitude(), candidate.getLongitude());
            if (distance < minDistance) {
                minDistance = distance;
                nearestIndex = i;
            }
        }

        return nearestIndex;
    }
}
