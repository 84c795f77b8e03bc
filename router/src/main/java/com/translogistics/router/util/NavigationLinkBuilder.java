package com.translogistics.router.util;

import com.translogistics.router.dto.NavigationLinks;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Deep links into external navigation apps. Coordinates take precedence over a street
 * address; with neither, every link is null.
 */
public final class NavigationLinkBuilder {

    private static final String GOOGLE_MAPS = "https://www.google.com/maps/dir/?api=1&destination=";
    private static final String WAZE = "https://waze.com/ul?";
    private static final String APPLE_MAPS = "https://maps.apple.com/?daddr=";

    private NavigationLinkBuilder() {
    }

    public static NavigationLinks forLocation(Double lat, Double lng, String address) {
        boolean hasCoordinates = lat != null && lng != null;
        String destination;
        if (hasCoordinates) {
            destination = lat + "," + lng;
        } else if (address != null && !address.isBlank()) {
            destination = address;
        } else {
            return NavigationLinks.none();
        }

        String encoded = encode(destination);
        String waze = hasCoordinates
                ? WAZE + "ll=" + lat + "," + lng + "&navigate=yes"
                : WAZE + "q=" + encoded + "&navigate=yes";

        return new NavigationLinks(GOOGLE_MAPS + encoded, waze, APPLE_MAPS + encoded);
    }

    public static NavigationLinks forCoordinates(double lat, double lng) {
        return forLocation(lat, lng, null);
    }

    // Matches encodeURIComponent: spaces as %20, not '+'
    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
