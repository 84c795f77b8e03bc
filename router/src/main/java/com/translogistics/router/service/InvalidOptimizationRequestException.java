package com.translogistics.router.service;

/**
 * The caller broke the request contract (missing vehicle constraints, depot, ...).
 * Data-quality problems in individual stops never raise this.
 */
public class InvalidOptimizationRequestException extends RuntimeException {

    public InvalidOptimizationRequestException(String message) {
        super(message);
    }
}
