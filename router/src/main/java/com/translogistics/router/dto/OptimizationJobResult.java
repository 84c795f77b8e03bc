package com.translogistics.router.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationJobResult {
    private String jobId;
    private OptimizedRoute route;
    private boolean success;
    private String errorMessage;

    public static OptimizationJobResult completed(String jobId, OptimizedRoute route) {
        return new OptimizationJobResult(jobId, route, true, null);
    }

    public static OptimizationJobResult failed(String jobId, String errorMessage) {
        return new OptimizationJobResult(jobId, null, false, errorMessage);
    }
}
