package com.translogistics.router.algorithm;

import com.translogistics.router.dto.Stop;
import lombok.Value;

import java.util.List;

@Value
public class FilterResult {
    List<Stop> acceptedStops;
    // Mutable: later stages append to these
    List<String> warnings;
    List<String> skippedStopIds;
}
