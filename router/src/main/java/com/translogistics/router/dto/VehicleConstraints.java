package com.translogistics.router.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VehicleConstraints {

    @NotNull
    @PositiveOrZero
    private Double capacityKg;

    @NotNull
    @Min(0)
    private Integer maxStops;

    @Positive
    private Double averageSpeedKmh;

    @PositiveOrZero
    private Double stopDurationMinutes;

    public VehicleConstraints(Double capacityKg, Integer maxStops) {
        this.capacityKg = capacityKg;
        this.maxStops = maxStops;
    }
}
