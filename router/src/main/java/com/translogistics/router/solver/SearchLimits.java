package com.translogistics.router.solver;

import lombok.Value;

import java.time.Duration;

@Value
public class SearchLimits {
    Duration timeLimit;
    int maxSolutionsWithoutImprovement;
}
