package com.translogistics.router.dto;

import com.translogistics.router.model.LocationQuality;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A delivery stop as the caller sent it. The optimizer only reads stops: filtering, ordering
 * and assembly never change a stop's fields, and results carry copies of the values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Stop {

    public static final int DEFAULT_PRIORITY = 5;

    @NotNull
    private String id;

    private String name;

    // Missing coordinates become a warning, not a 400
    private Double latitude;

    private Double longitude;

    private Double demandKg;

    @Valid
    private TimeWindow timeWindow;

    // 1-10, higher = more important
    private Integer priority;

    private LocationQuality locationQuality;

    public Stop(String id, String name, Double latitude, Double longitude) {
        this.id = id;
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public double effectiveDemandKg() {
        return demandKg != null ? demandKg : 0.0;
    }

    public int effectivePriority() {
        return priority != null ? priority : DEFAULT_PRIORITY;
    }

    public boolean hasValidCoordinates() {
        return latitude != null && longitude != null
                && Double.isFinite(latitude) && Double.isFinite(longitude);
    }
}
