package com.translogistics.router.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the route optimizer, bound from {@code router.optimizer.*}.
 */
@Data
@ConfigurationProperties(prefix = "router.optimizer")
public class OptimizerProperties {

    /**
     * Average vehicle speed when a request does not give one. Urban delivery pace.
     */
    private double defaultSpeedKmh = 25;

    /**
     * Time spent at each stop when a request does not give one.
     */
    private double defaultStopDurationMinutes = 10;

    private Solver solver = new Solver();

    @Data
    public static class Solver {

        /**
         * Set to false to always use the nearest-neighbor heuristic.
         */
        private boolean enabled = true;

        /**
         * Longest time a caller waits for the external solver.
         */
        private Duration timeLimit = Duration.ofSeconds(5);

        /**
         * Reserved out of the time limit for model setup and result extraction.
         */
        private Duration setupMargin = Duration.ofMillis(500);

        private int maxSolutionsWithoutImprovement = 100;

        private int threads = 2;

        public Duration searchBudget() {
            Duration budget = timeLimit.minus(setupMargin);
            return budget.isNegative() || budget.isZero() ? timeLimit : budget;
        }
    }
}
