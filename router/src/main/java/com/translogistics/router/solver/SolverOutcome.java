package com.translogistics.router.solver;

import com.translogistics.router.dto.Stop;

import java.util.Collections;
import java.util.List;

/**
 * Either a solved visiting order or a signal to fall back, with the reason.
 */
public final class SolverOutcome {

    private final List<Stop> route;
    private final String fallbackReason;

    private SolverOutcome(List<Stop> route, String fallbackReason) {
        this.route = route;
        this.fallbackReason = fallbackReason;
    }

    public static SolverOutcome solved(List<Stop> route) {
        return new SolverOutcome(Collections.unmodifiableList(route), null);
    }

    public static SolverOutcome fallback(String reason) {
        return new SolverOutcome(Collections.emptyList(), reason);
    }

    public boolean isSolved() {
        return fallbackReason == null;
    }

    public List<Stop> getRoute() {
        return route;
    }

    public String getFallbackReason() {
        return fallbackReason;
    }
}
