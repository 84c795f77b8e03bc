package com.translogistics.router.solver;

import com.google.ortools.Loader;
import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.LocalSearchMetaheuristic;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.RoutingSearchParameters;
import com.google.ortools.constraintsolver.main;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Capacitated single-vehicle routing on Google OR-Tools.
 */
public class OrToolsRoutingSolver implements RoutingSolver {

    private static final Logger logger = LoggerFactory.getLogger(OrToolsRoutingSolver.class);

    private OrToolsRoutingSolver() {
    }

    /**
     * Loads the OR-Tools native libraries. Meant to be called once per process.
     *
     * @return the solver, or empty when the native libraries cannot be loaded on this platform
     */
    public static Optional<RoutingSolver> probe() {
        try {
            Loader.loadNativeLibraries();
            logger.info("OR-Tools native libraries loaded, solver enabled");
            return Optional.of(new OrToolsRoutingSolver());
        } catch (LinkageError | RuntimeException e) {
            logger.warn("OR-Tools not available, routes will use the nearest-neighbor heuristic: {}",
                    e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String name() {
        return "OR-Tools";
    }

    @Override
    public List<Integer> solve(RoutingProblem problem, SearchLimits limits, CancellationToken cancellationToken)
            throws SolverException {
        try {
            RoutingIndexManager manager = new RoutingIndexManager(
                    problem.nodeCount(), RoutingProblem.VEHICLE_COUNT, RoutingProblem.DEPOT);
            RoutingModel routing = new RoutingModel(manager);

            long[][] distances = problem.getDistanceMeters();
            long[][] travel = problem.getTravelSeconds();
            long[] service = problem.getServiceSeconds();
            long[] demands = problem.getDemands();

            final int distanceCallback = routing.registerTransitCallback((long fromIndex, long toIndex) ->
                    distances[manager.indexToNode(fromIndex)][manager.indexToNode(toIndex)]);
            routing.setArcCostEvaluatorOfAllVehicles(distanceCallback);

            final int demandCallback = routing.registerUnaryTransitCallback((long fromIndex) ->
                    demands[manager.indexToNode(fromIndex)]);
            routing.addDimensionWithVehicleCapacity(
                    demandCallback,
                    0,
                    new long[]{problem.getVehicleCapacity()},
                    true,
                    "Capacity");

            final int timeCallback = routing.registerTransitCallback((long fromIndex, long toIndex) -> {
                int fromNode = manager.indexToNode(fromIndex);
                return travel[fromNode][manager.indexToNode(toIndex)] + service[fromNode];
            });
            routing.addDimension(timeCallback, 0, RoutingProblem.HORIZON_SECONDS, true, "Time");

            ImprovementMonitor monitor = new ImprovementMonitor(limits.getMaxSolutionsWithoutImprovement());
            routing.addAtSolutionCallback(() -> {
                if (cancellationToken.isCancelled() || monitor.stalled(routing.costVar().value())) {
                    routing.solver().finishCurrentSearch();
                }
            });

            long timeLimitMillis = Math.max(1, limits.getTimeLimit().toMillis());
            RoutingSearchParameters searchParameters = main.defaultRoutingSearchParameters()
                    .toBuilder()
                    .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PATH_CHEAPEST_ARC)
                    .setLocalSearchMetaheuristic(LocalSearchMetaheuristic.Value.GUIDED_LOCAL_SEARCH)
                    .setTimeLimit(com.google.protobuf.Duration.newBuilder()
                            .setSeconds(timeLimitMillis / 1000)
                            .setNanos((int) (timeLimitMillis % 1000) * 1_000_000)
                            .build())
                    .build();

            Assignment solution = routing.solveWithParameters(searchParameters);
            if (solution == null) {
                logger.warn("OR-Tools found no solution for {} nodes", problem.nodeCount());
                return Collections.emptyList();
            }

            List<Integer> order = new ArrayList<>(problem.nodeCount() - 1);
            long index = routing.start(0);
            while (!routing.isEnd(index)) {
                int node = manager.indexToNode(index);
                if (node != RoutingProblem.DEPOT) {
                    order.add(node);
                }
                index = solution.value(routing.nextVar(index));
            }

            logger.debug("OR-Tools route over {} nodes after {} solutions, cost {} m",
                    problem.nodeCount(), monitor.solutions(), solution.objectiveValue());
            return order;
        } catch (RuntimeException e) {
            throw new SolverException("OR-Tools search failed: " + e.getMessage(), e);
        }
    }

    /**
     * Counts consecutive solutions that fail to lower the best cost seen.
     */
    static class ImprovementMonitor {
        private final int limit;
        private long bestCost = Long.MAX_VALUE;
        private int withoutImprovement;
        private int solutions;

        ImprovementMonitor(int limit) {
            this.limit = limit;
        }

        boolean stalled(long cost) {
            solutions++;
            if (cost < bestCost) {
                bestCost = cost;
                withoutImprovement = 0;
                return false;
            }
            withoutImprovement++;
            return withoutImprovement >= limit;
        }

        int solutions() {
            return solutions;
        }
    }
}
