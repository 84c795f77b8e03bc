package com.translogistics.router.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NavigationLinks {
    private String googleMaps;
    private String waze;
    private String appleMaps;

    public static NavigationLinks none() {
        return new NavigationLinks(null, null, null);
    }
}
