package com.translogistics.router.config;

import com.translogistics.router.algorithm.ConstraintFilter;
import com.translogistics.router.algorithm.HeuristicSolver;
import com.translogistics.router.algorithm.RouteAssembler;
import com.translogistics.router.algorithm.SimpleRouter;
import com.translogistics.router.service.RouteOptimizationService;
import com.translogistics.router.solver.OrToolsRoutingSolver;
import com.translogistics.router.solver.RoutingSolver;
import com.translogistics.router.solver.SolverAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(OptimizerProperties.class)
public class OptimizerConfig {

    private static final Logger logger = LoggerFactory.getLogger(OptimizerConfig.class);

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService routingSolverExecutor(OptimizerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "route-solver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getSolver().getThreads(), threadFactory);
    }

    @Bean
    public RouteOptimizationService routeOptimizationService(OptimizerProperties properties,
                                                             ExecutorService routingSolverExecutor) {
        OptimizerProperties.Solver solver = properties.getSolver();
        SolverAdapter solverAdapter = new SolverAdapter(
                detectRoutingSolver(solver),
                routingSolverExecutor,
                solver.getTimeLimit(),
                solver.searchBudget(),
                solver.getMaxSolutionsWithoutImprovement());

        return new RouteOptimizationService(
                new ConstraintFilter(),
                solverAdapter,
                new HeuristicSolver(),
                new SimpleRouter(),
                new RouteAssembler(),
                properties.getDefaultSpeedKmh(),
                properties.getDefaultStopDurationMinutes());
    }

    /**
     * Runs once, while the context starts. The decision holds for the process lifetime.
     */
    static Optional<RoutingSolver> detectRoutingSolver(OptimizerProperties.Solver solver) {
        if (!solver.isEnabled()) {
            logger.info("External route solver disabled by configuration");
            return Optional.empty();
        }
        return OrToolsRoutingSolver.probe();
    }
}
