package com.translogistics.router.algorithm;

import com.translogistics.router.dto.Stop;
import com.translogistics.router.model.OptimizationMethod;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the received order. Used when there are too few stops for ordering to matter.
 */
public class SimpleRouter {

    public static final int MAX_STOPS_WITHOUT_OPTIMIZATION = 2;

    public boolean handles(List<Stop> stops) {
        return stops.size() <= MAX_STOPS_WITHOUT_OPTIMIZATION;
    }

    public StopOrdering route(List<Stop> stops) {
        return new StopOrdering(new ArrayList<>(stops), OptimizationMethod.AS_PROVIDED);
    }
}
