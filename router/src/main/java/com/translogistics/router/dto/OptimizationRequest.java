package com.translogistics.router.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationRequest {

    @NotNull
    private Double depotLatitude;

    @NotNull
    private Double depotLongitude;

    // An empty list is a valid request and yields an empty route with a warning
    @NotNull
    @Valid
    private List<Stop> stops;

    @NotNull
    @Valid
    private VehicleConstraints vehicle;

    private Boolean returnToDepot;

    public OptimizationRequest(Double depotLatitude, Double depotLongitude, List<Stop> stops,
                               VehicleConstraints vehicle) {
        this(depotLatitude, depotLongitude, stops, vehicle, null);
    }

    public boolean shouldReturnToDepot() {
        return returnToDepot == null || returnToDepot;
    }
}
