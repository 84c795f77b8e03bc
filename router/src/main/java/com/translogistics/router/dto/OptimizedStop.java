package com.translogistics.router.dto;

import com.translogistics.router.model.LocationQuality;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizedStop {
    private String id;
    private String name;
    private int sequence;
    private double latitude;
    private double longitude;
    private double distanceFromPreviousKm;
    private long estimatedArrivalMinutes;
    private Double demandKg;
    private LocationQuality locationQuality;
    private NavigationLinks navigation;
}
