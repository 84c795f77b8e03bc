package com.translogistics.router.algorithm;

import com.translogistics.router.dto.Stop;
import com.translogistics.router.model.LocationQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Trims a stop list to what one vehicle can take. Every exclusion is recorded as a
 * warning plus a skipped id; nothing here throws for bad data.
 */
public class ConstraintFilter {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintFilter.class);

    public FilterResult filter(List<Stop> stops, double capacityKg, int maxStops) {
        List<String> warnings = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        List<Stop> validStops = new ArrayList<>();
        for (Stop stop : stops) {
            if (stop.hasValidCoordinates()) {
                validStops.add(stop);
            } else {
                warnings.add(String.format("Stop %s skipped: invalid coordinates", stop.getId()));
                skipped.add(stop.getId());
            }
        }

        if (validStops.size() > maxStops) {
            // List.sort is stable, equal priorities keep their input order
            List<Stop> byPriority = new ArrayList<>(validStops);
            byPriority.sort(Comparator.comparingInt(Stop::effectivePriority).reversed());

            List<Stop> dropped = byPriority.subList(maxStops, byPriority.size());
            for (Stop stop : dropped) {
                skipped.add(stop.getId());
            }
            warnings.add(String.format("Max stops (%d) exceeded, optimizing subset (%d stops skipped)",
                    maxStops, dropped.size()));
            logger.info("Truncated {} stops to max {} by priority", validStops.size(), maxStops);

            validStops = new ArrayList<>(byPriority.subList(0, maxStops));
        }

        // Greedy and order-dependent: a heavy early stop can block lighter later ones
        double totalDemand = 0.0;
        List<Stop> accepted = new ArrayList<>();
        for (Stop stop : validStops) {
            double demand = stop.effectiveDemandKg();
            if (totalDemand + demand <= capacityKg) {
                accepted.add(stop);
                totalDemand += demand;
            } else {
                warnings.add(String.format("Stop %s skipped: exceeds vehicle capacity", stop.getId()));
                skipped.add(stop.getId());
            }
        }

        long approximate = accepted.stream()
                .filter(s -> s.getLocationQuality() == LocationQuality.APPROXIMATE)
                .count();
        if (approximate > 0) {
            warnings.add(String.format("%d stops have approximate locations", approximate));
        }

        logger.debug("Filtered {} stops down to {} ({} skipped, load {} / {} kg)",
                stops.size(), accepted.size(), skipped.size(), totalDemand, capacityKg);

        return new FilterResult(accepted, warnings, skipped);
    }
}
