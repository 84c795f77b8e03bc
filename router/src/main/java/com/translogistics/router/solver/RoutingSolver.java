package com.translogistics.router.solver;

import java.util.List;

/**
 * An external single-vehicle routing engine.
 */
public interface RoutingSolver {

    /**
     * Solves the problem within the given limits.
     *
     * @return node indices in visiting order, depot excluded; empty when no solution was found
     * @throws SolverException if the engine fails
     */
    List<Integer> solve(RoutingProblem problem, SearchLimits limits, CancellationToken cancellationToken)
            throws SolverException;

    String name();
}
