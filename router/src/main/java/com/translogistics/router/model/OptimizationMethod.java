package com.translogistics.router.model;

public enum OptimizationMethod {
    SOLVER,
    HEURISTIC,
    AS_PROVIDED
}
