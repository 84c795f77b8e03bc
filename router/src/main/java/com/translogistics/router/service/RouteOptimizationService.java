package com.translogistics.router.service;

import com.translogistics.router.algorithm.ConstraintFilter;
import com.translogistics.router.algorithm.DistanceModel;
import com.translogistics.router.algorithm.FilterResult;
import com.translogistics.router.algorithm.HeuristicSolver;
import com.translogistics.router.algorithm.RouteAssembler;
import com.translogistics.router.algorithm.RouteContext;
import com.translogistics.router.algorithm.SimpleRouter;
import com.translogistics.router.algorithm.StopOrdering;
import com.translogistics.router.dto.OptimizationRequest;
import com.translogistics.router.dto.OptimizedRoute;
import com.translogistics.router.dto.RouteEstimate;
import com.translogistics.router.dto.RouteEstimateRequest;
import com.translogistics.router.dto.Stop;
import com.translogistics.router.dto.VehicleConstraints;
import com.translogistics.router.model.OptimizationMethod;
import com.translogistics.router.solver.SolverAdapter;
import com.translogistics.router.solver.SolverOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Suggests a visiting order for one vehicle's deliveries. The result is advisory; callers
 * may reorder or ignore it. Holds no per-call state and is safe to share between threads.
 */
public class RouteOptimizationService {

    private static final Logger logger = LoggerFactory.getLogger(RouteOptimizationService.class);

    static final String NO_STOPS_WARNING = "No stops provided";

    private final ConstraintFilter constraintFilter;
    private final SolverAdapter solverAdapter;
    private final HeuristicSolver heuristicSolver;
    private final SimpleRouter simpleRouter;
    private final RouteAssembler routeAssembler;
    private final double defaultSpeedKmh;
    private final double defaultStopDurationMinutes;

    public RouteOptimizationService(ConstraintFilter constraintFilter,
                                    SolverAdapter solverAdapter,
                                    HeuristicSolver heuristicSolver,
                                    SimpleRouter simpleRouter,
                                    RouteAssembler routeAssembler,
                                    double defaultSpeedKmh,
                                    double defaultStopDurationMinutes) {
        this.constraintFilter = constraintFilter;
        this.solverAdapter = solverAdapter;
        this.heuristicSolver = heuristicSolver;
        this.simpleRouter = simpleRouter;
        this.routeAssembler = routeAssembler;
        this.defaultSpeedKmh = defaultSpeedKmh;
        this.defaultStopDurationMinutes = defaultStopDurationMinutes;
    }

    public OptimizedRoute optimizeRoute(OptimizationRequest request) {
        RouteContext context = resolveContext(request);
        List<Stop> stops = request.getStops() != null ? request.getStops() : List.of();

        if (stops.isEmpty()) {
            logger.warn("No stops provided in optimization request");
            List<String> warnings = new ArrayList<>();
            warnings.add(NO_STOPS_WARNING);
            return routeAssembler.assemble(context, simpleRouter.route(stops), warnings, new ArrayList<>());
        }

        FilterResult filtered = constraintFilter.filter(stops, context.getCapacityKg(), context.getMaxStops());
        List<Stop> accepted = filtered.getAcceptedStops();
        List<String> warnings = filtered.getWarnings();

        StopOrdering ordering;
        if (simpleRouter.handles(accepted)) {
            ordering = simpleRouter.route(accepted);
        } else {
            SolverOutcome outcome = solverAdapter.solve(context, accepted);
            if (outcome.isSolved()) {
                ordering = new StopOrdering(outcome.getRoute(), OptimizationMethod.SOLVER);
            } else {
                warnings.add(String.format("Route solver %s, using nearest-neighbor heuristic fallback",
                        outcome.getFallbackReason()));
                ordering = heuristicSolver.solve(context.getDepotLatitude(), context.getDepotLongitude(), accepted);
            }
        }

        OptimizedRoute route = routeAssembler.assemble(context, ordering, warnings, filtered.getSkippedStopIds());
        logger.info("Optimized {} of {} stops with {}: {} km, {} min, {} skipped",
                route.getOrderedStops().size(), stops.size(), route.getOptimizationMethod(),
                route.getTotalDistanceKm(), route.getEstimatedDurationMinutes(), route.getStopsSkipped().size());
        return route;
    }

    /**
     * Distance and duration of visiting the stops in the given order and returning to the
     * depot. No filtering or reordering.
     */
    public RouteEstimate estimateRoute(RouteEstimateRequest request) {
        if (request == null) {
            throw new InvalidOptimizationRequestException("Estimate request is required");
        }
        double depotLat = requireCoordinate(request.getDepotLatitude(), "depotLatitude");
        double depotLng = requireCoordinate(request.getDepotLongitude(), "depotLongitude");
        double speed = resolveSpeed(request.getAverageSpeedKmh());
        double stopDuration = resolveStopDuration(request.getStopDurationMinutes());
        List<Stop> stops = request.getStops() != null ? request.getStops() : List.of();

        double totalDistance = 0.0;
        double previousLat = depotLat;
        double previousLng = depotLng;
        int counted = 0;
        for (Stop stop : stops) {
            if (!stop.hasValidCoordinates()) {
                continue;
            }
            totalDistance += DistanceModel.haversineKm(previousLat, previousLng, stop.getLatitude(), stop.getLongitude());
            previousLat = stop.getLatitude();
            previousLng = stop.getLongitude();
            counted++;
        }
        totalDistance += DistanceModel.haversineKm(previousLat, previousLng, depotLat, depotLng);

        double minutes = totalDistance / speed * 60 + counted * stopDuration;
        return new RouteEstimate(RouteAssembler.roundKm(totalDistance), Math.round(minutes));
    }

    RouteContext resolveContext(OptimizationRequest request) {
        if (request == null) {
            throw new InvalidOptimizationRequestException("Optimization request is required");
        }
        double depotLat = requireCoordinate(request.getDepotLatitude(), "depotLatitude");
        double depotLng = requireCoordinate(request.getDepotLongitude(), "depotLongitude");

        VehicleConstraints vehicle = request.getVehicle();
        if (vehicle == null) {
            throw new InvalidOptimizationRequestException("Vehicle constraints are required");
        }
        if (vehicle.getCapacityKg() == null || !Double.isFinite(vehicle.getCapacityKg()) || vehicle.getCapacityKg() < 0) {
            throw new InvalidOptimizationRequestException("Vehicle capacityKg must be a non-negative number");
        }
        if (vehicle.getMaxStops() == null || vehicle.getMaxStops() < 0) {
            throw new InvalidOptimizationRequestException("Vehicle maxStops must be a non-negative integer");
        }

        return new RouteContext(
                depotLat,
                depotLng,
                vehicle.getCapacityKg(),
                vehicle.getMaxStops(),
                resolveSpeed(vehicle.getAverageSpeedKmh()),
                resolveStopDuration(vehicle.getStopDurationMinutes()),
                request.shouldReturnToDepot());
    }

    private double resolveSpeed(Double speedKmh) {
        if (speedKmh == null) {
            return defaultSpeedKmh;
        }
        if (!Double.isFinite(speedKmh) || speedKmh <= 0) {
            throw new InvalidOptimizationRequestException("averageSpeedKmh must be positive");
        }
        return speedKmh;
    }

    private double resolveStopDuration(Double minutes) {
        if (minutes == null) {
            return defaultStopDurationMinutes;
        }
        if (!Double.isFinite(minutes) || minutes < 0) {
            throw new InvalidOptimizationRequestException("stopDurationMinutes must not be negative");
        }
        return minutes;
    }

    private static double requireCoordinate(Double value, String field) {
        if (value == null || !Double.isFinite(value)) {
            throw new InvalidOptimizationRequestException(field + " is required");
        }
        return value;
    }
}
