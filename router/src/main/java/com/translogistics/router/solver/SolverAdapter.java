package com.translogistics.router.solver;

import com.translogistics.router.algorithm.DistanceModel;
import com.translogistics.router.algorithm.RouteContext;
import com.translogistics.router.dto.Stop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bridges the optimizer to an optional {@link RoutingSolver}. The solver runs on its own
 * executor and the caller waits at most {@code timeout}; every failure mode comes back as
 * {@link SolverOutcome#fallback(String)}, never as an exception.
 */
public class SolverAdapter {

    private static final Logger logger = LoggerFactory.getLogger(SolverAdapter.class);

    private final Optional<RoutingSolver> solver;
    private final ExecutorService executor;
    private final Duration timeout;
    private final SearchLimits searchLimits;

    public SolverAdapter(Optional<RoutingSolver> solver, ExecutorService executor,
                         Duration timeout, Duration searchBudget, int maxSolutionsWithoutImprovement) {
        this.solver = solver;
        this.executor = executor;
        this.timeout = timeout;
        this.searchLimits = new SearchLimits(searchBudget, maxSolutionsWithoutImprovement);
    }

    public boolean isAvailable() {
        return solver.isPresent();
    }

    public SolverOutcome solve(RouteContext context, List<Stop> stops) {
        if (solver.isEmpty()) {
            return SolverOutcome.fallback("unavailable");
        }

        RoutingSolver routingSolver = solver.get();
        RoutingProblem problem = buildProblem(context, stops);
        CancellationToken token = new CancellationToken();

        Future<List<Integer>> future;
        try {
            future = executor.submit(() -> routingSolver.solve(problem, searchLimits, token));
        } catch (RejectedExecutionException e) {
            logger.error("{} rejected route with {} stops: {}", routingSolver.name(), stops.size(), e.getMessage());
            return SolverOutcome.fallback("rejected the request");
        }

        List<Integer> nodes;
        try {
            nodes = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            token.cancel();
            future.cancel(true);
            logger.warn("{} timed out after {} ms for {} stops", routingSolver.name(), timeout.toMillis(), stops.size());
            return SolverOutcome.fallback("timed out");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("{} failed for {} stops: {}", routingSolver.name(), stops.size(), cause.getMessage(), cause);
            return SolverOutcome.fallback("failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            future.cancel(true);
            logger.error("Interrupted while waiting for {}", routingSolver.name());
            return SolverOutcome.fallback("interrupted");
        }

        if (nodes == null || nodes.isEmpty()) {
            logger.warn("{} returned no solution for {} stops", routingSolver.name(), stops.size());
            return SolverOutcome.fallback("found no solution");
        }

        List<Stop> route = new ArrayList<>(nodes.size());
        boolean[] seen = new boolean[stops.size() + 1];
        for (Integer node : nodes) {
            if (node == null || node <= RoutingProblem.DEPOT || node > stops.size() || seen[node]) {
                continue;
            }
            seen[node] = true;
            route.add(stops.get(node - 1));
        }

        if (route.size() != stops.size()) {
            logger.warn("{} visited {} of {} stops, discarding solution",
                    routingSolver.name(), route.size(), stops.size());
            return SolverOutcome.fallback("returned an incomplete solution");
        }

        logger.info("{} solved route with {} stops", routingSolver.name(), stops.size());
        return SolverOutcome.solved(route);
    }

    RoutingProblem buildProblem(RouteContext context, List<Stop> stops) {
        double[][] km = DistanceModel.distanceMatrixKm(context.getDepotLatitude(), context.getDepotLongitude(), stops);
        int n = km.length;

        long[][] distanceMeters = new long[n][n];
        long[][] travelSeconds = new long[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                // Open routes end at the last stop, so arcs back to the depot are free
                if (j == RoutingProblem.DEPOT && !context.isReturnToDepot()) {
                    continue;
                }
                distanceMeters[i][j] = Math.round(km[i][j] * 1000);
                travelSeconds[i][j] = Math.round(context.travelMinutes(km[i][j]) * 60);
            }
        }

        long serviceSeconds = Math.round(context.getStopDurationMinutes() * 60);
        long[] service = new long[n];
        long[] demands = new long[n];
        for (int i = 1; i < n; i++) {
            service[i] = serviceSeconds;
            demands[i] = Math.round(stops.get(i - 1).effectiveDemandKg() * RoutingProblem.DEMAND_SCALE);
        }

        long capacity = Math.round(context.getCapacityKg() * RoutingProblem.DEMAND_SCALE);
        return new RoutingProblem(distanceMeters, travelSeconds, service, demands, capacity);
    }
}
