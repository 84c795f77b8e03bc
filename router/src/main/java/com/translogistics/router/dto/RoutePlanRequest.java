package com.translogistics.router.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoutePlanRequest {

    private Double hubLatitude;

    private Double hubLongitude;

    @NotNull
    @PositiveOrZero
    private Double vehicleCapacityKg;

    @Min(0)
    private Integer maxStops;

    @NotNull
    @Valid
    private List<DeliveryRecord> deliveries;
}
