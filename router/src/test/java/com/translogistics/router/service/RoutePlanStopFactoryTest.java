package com.translogistics.router.service;

import com.translogistics.router.dto.DeliveryRecord;
import com.translogistics.router.dto.OptimizationRequest;
import com.translogistics.router.dto.RoutePlanRequest;
import com.translogistics.router.dto.Stop;
import com.translogistics.router.model.LocationQuality;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RoutePlanStopFactoryTest {

    @Test
    void shouldPlaceDeliveriesNearHubAsApproximate() {
        RoutePlanStopFactory factory = new RoutePlanStopFactory(new Random(42));
        List<DeliveryRecord> deliveries = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            deliveries.add(new DeliveryRecord("SHP-" + i, "Rue " + i, 2.0));
        }

        OptimizationRequest request = factory.toOptimizationRequest(
                new RoutePlanRequest(5.30, -4.00, 100.0, 10, deliveries));

        assertEquals(5.30, request.getDepotLatitude());
        assertEquals(-4.00, request.getDepotLongitude());
        assertEquals(50, request.getStops().size());
        for (Stop stop : request.getStops()) {
            assertTrue(Math.abs(stop.getLatitude() - 5.30) <= RoutePlanStopFactory.JITTER_DEGREES + 1e-9);
            assertTrue(Math.abs(stop.getLongitude() + 4.00) <= RoutePlanStopFactory.JITTER_DEGREES + 1e-9);
            assertEquals(LocationQuality.APPROXIMATE, stop.getLocationQuality());
        }
        assertEquals(100.0, request.getVehicle().getCapacityKg());
        assertEquals(10, request.getVehicle().getMaxStops());
        assertTrue(request.shouldReturnToDepot());
    }

    @Test
    void shouldDrawNewOffsetsOnEveryCall() {
        RoutePlanStopFactory factory = new RoutePlanStopFactory(new Random(7));
        RoutePlanRequest plan = new RoutePlanRequest(5.30, -4.00, 100.0, 10,
                Arrays.asList(new DeliveryRecord("SHP-1", "Rue 1", 1.0)));

        Stop first = factory.toOptimizationRequest(plan).getStops().get(0);
        Stop second = factory.toOptimizationRequest(plan).getStops().get(0);

        assertNotEquals(first.getLatitude(), second.getLatitude());
    }

    @Test
    void shouldFallBackToDefaultHubAndFieldDefaults() {
        RoutePlanStopFactory factory = new RoutePlanStopFactory(new Random(1));
        RoutePlanRequest plan = new RoutePlanRequest(null, 0.0, 50.0, null,
                Arrays.asList(new DeliveryRecord("SHP-9", null, null)));

        OptimizationRequest request = factory.toOptimizationRequest(plan);

        assertEquals(RoutePlanStopFactory.DEFAULT_HUB_LATITUDE, request.getDepotLatitude());
        assertEquals(RoutePlanStopFactory.DEFAULT_HUB_LONGITUDE, request.getDepotLongitude());
        assertEquals(RoutePlanStopFactory.DEFAULT_MAX_STOPS, request.getVehicle().getMaxStops());

        Stop stop = request.getStops().get(0);
        assertEquals("SHP-9", stop.getId());
        assertEquals("Unknown", stop.getName());
        assertEquals(0.0, stop.getDemandKg());
    }
}
