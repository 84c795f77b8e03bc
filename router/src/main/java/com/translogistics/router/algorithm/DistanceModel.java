package com.translogistics.router.algorithm;

import com.translogistics.router.dto.Stop;

import java.util.List;

/**
 * Great-circle distances between geographic points.
 */
public final class DistanceModel {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private DistanceModel() {
    }

    /**
     * Haversine distance in kilometres between two points given in decimal degrees.
     */
    public static double haversineKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) *
                        Math.sin(dLng / 2) * Math.sin(dLng / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }

    /**
     * Full distance matrix in kilometres. Index 0 is the depot, index i is {@code stops.get(i - 1)}.
     */
    public static double[][] distanceMatrixKm(double depotLat, double depotLng, List<Stop> stops) {
        int n = stops.size() + 1;
        double[] lats = new double[n];
        double[] lngs = new double[n];
        lats[0] = depotLat;
        lngs[0] = depotLng;
        for (int i = 1; i < n; i++) {
            lats[i] = stops.get(i - 1).getLatitude();
            lngs[i] = stops.get(i - 1).getLongitude();
        }

        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                matrix[i][j] = i == j ? 0.0 : haversineKm(lats[i], lngs[i], lats[j], lngs[j]);
            }
        }
        return matrix;
    }
}
