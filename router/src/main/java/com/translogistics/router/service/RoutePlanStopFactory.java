package com.translogistics.router.service;

import com.translogistics.router.dto.DeliveryRecord;
import com.translogistics.router.dto.OptimizationRequest;
import com.translogistics.router.dto.RoutePlanRequest;
import com.translogistics.router.dto.Stop;
import com.translogistics.router.dto.VehicleConstraints;
import com.translogistics.router.model.LocationQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds an optimization request from a driver's route plan.
 *
 * <p>PLACEHOLDER: deliveries are not geocoded yet, so every stop is placed at the hub plus a
 * random offset of up to {@value #JITTER_DEGREES} degrees on each axis and flagged
 * {@link LocationQuality#APPROXIMATE}. A new offset is drawn on every call. It is not known
 * whether downstream consumers depend on that randomness or would expect stable positions,
 * so the behavior is kept exactly as it is until real coordinates are available.
 */
@Component
public class RoutePlanStopFactory {

    private static final Logger logger = LoggerFactory.getLogger(RoutePlanStopFactory.class);

    // Abidjan
    static final double DEFAULT_HUB_LATITUDE = 5.56;
    static final double DEFAULT_HUB_LONGITUDE = -4.01;
    static final double JITTER_DEGREES = 0.01;
    static final int DEFAULT_MAX_STOPS = 20;

    private final Random random;

    @Autowired
    public RoutePlanStopFactory() {
        this(new Random());
    }

    RoutePlanStopFactory(Random random) {
        this.random = random;
    }

    public OptimizationRequest toOptimizationRequest(RoutePlanRequest plan) {
        double hubLat = orDefault(plan.getHubLatitude(), DEFAULT_HUB_LATITUDE);
        double hubLng = orDefault(plan.getHubLongitude(), DEFAULT_HUB_LONGITUDE);

        List<Stop> stops = new ArrayList<>();
        for (DeliveryRecord delivery : plan.getDeliveries()) {
            stops.add(new Stop(
                    delivery.getShipmentId(),
                    delivery.getDestAddressLine1() != null ? delivery.getDestAddressLine1() : "Unknown",
                    hubLat + (random.nextDouble() - 0.5) * 2 * JITTER_DEGREES,
                    hubLng + (random.nextDouble() - 0.5) * 2 * JITTER_DEGREES,
                    delivery.getDeclaredWeightKg() != null ? delivery.getDeclaredWeightKg() : 0.0,
                    null,
                    null,
                    LocationQuality.APPROXIMATE));
        }

        logger.debug("Placed {} deliveries around hub ({}, {}) with synthetic coordinates",
                stops.size(), hubLat, hubLng);

        VehicleConstraints vehicle = new VehicleConstraints(
                plan.getVehicleCapacityKg(),
                plan.getMaxStops() != null ? plan.getMaxStops() : DEFAULT_MAX_STOPS);

        return new OptimizationRequest(hubLat, hubLng, stops, vehicle, true);
    }

    // Zero is treated as "not set", like a missing hub coordinate
    private static double orDefault(Double value, double fallback) {
        return value == null || value == 0.0 || !Double.isFinite(value) ? fallback : value;
    }
}
