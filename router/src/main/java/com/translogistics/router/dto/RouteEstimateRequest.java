package com.translogistics.router.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteEstimateRequest {

    @NotNull
    private Double depotLatitude;

    @NotNull
    private Double depotLongitude;

    @NotNull
    @Valid
    private List<Stop> stops;

    @Positive
    private Double averageSpeedKmh;

    @PositiveOrZero
    private Double stopDurationMinutes;
}
