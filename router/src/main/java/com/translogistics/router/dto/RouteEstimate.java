package com.translogistics.router.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteEstimate {
    private double totalDistanceKm;
    private long estimatedDurationMinutes;
}
