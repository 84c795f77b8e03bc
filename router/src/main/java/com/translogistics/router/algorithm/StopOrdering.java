package com.translogistics.router.algorithm;

import com.translogistics.router.dto.Stop;
import com.translogistics.router.model.OptimizationMethod;
import lombok.Value;

import java.util.List;

/**
 * A visiting order and the method that produced it.
 */
@Value
public class StopOrdering {
    List<Stop> stops;
    OptimizationMethod method;
}
