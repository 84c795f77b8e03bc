package com.translogistics.router.dto;

import com.translogistics.router.model.OptimizationMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizedRoute {

    @Builder.Default
    private List<OptimizedStop> orderedStops = new ArrayList<>();

    private double totalDistanceKm;

    private long estimatedDurationMinutes;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Builder.Default
    private List<String> stopsSkipped = new ArrayList<>();

    private OptimizationMethod optimizationMethod;
}
