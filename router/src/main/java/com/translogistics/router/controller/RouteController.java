package com.translogistics.router.controller;

import com.translogistics.router.dto.ApiError;
import com.translogistics.router.dto.OptimizationJobResult;
import com.translogistics.router.dto.OptimizationRequest;
import com.translogistics.router.dto.OptimizedRoute;
import com.translogistics.router.dto.RouteEstimate;
import com.translogistics.router.dto.RouteEstimateRequest;
import com.translogistics.router.dto.RoutePlanRequest;
import com.translogistics.router.service.InvalidOptimizationRequestException;
import com.translogistics.router.service.JobTrackingService;
import com.translogistics.router.service.OptimizationJobProducer;
import com.translogistics.router.service.RouteOptimizationService;
import com.translogistics.router.service.RoutePlanStopFactory;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Optional;

@RestController
@RequestMapping("/api/route")
public class RouteController {

    private static final Logger logger = LoggerFactory.getLogger(RouteController.class);

    @Autowired
    private RouteOptimizationService routeOptimizationService;

    @Autowired
    private OptimizationJobProducer optimizationJobProducer;

    @Autowired
    private JobTrackingService jobTrackingService;

    @Autowired
    private RoutePlanStopFactory routePlanStopFactory;

    @Value("${kafka.enabled:true}")
    private boolean kafkaEnabled;

    @Value("${kafka.batch.threshold:50}")
    private int kafkaBatchThreshold;

    @Value("${kafka.job.timeout:PT3M}")
    private Duration jobTimeout;

    @PostMapping("/optimize")
    public ResponseEntity<OptimizedRoute> optimizeRoute(@Valid @RequestBody OptimizationRequest request) {
        int stopCount = request.getStops().size();
        logger.info("Received optimization request for {} stops", stopCount);

        // Use Kafka for large requests, direct processing for small ones
        if (kafkaEnabled && stopCount > kafkaBatchThreshold) {
            return handleWithKafka(request);
        }
        return ResponseEntity.ok(routeOptimizationService.optimizeRoute(request));
    }

    @PostMapping("/estimate")
    public ResponseEntity<RouteEstimate> estimateRoute(@Valid @RequestBody RouteEstimateRequest request) {
        return ResponseEntity.ok(routeOptimizationService.estimateRoute(request));
    }

    @PostMapping("/plans/optimize")
    public ResponseEntity<OptimizedRoute> optimizeRoutePlan(@Valid @RequestBody RoutePlanRequest request) {
        logger.info("Received route plan with {} deliveries", request.getDeliveries().size());
        OptimizationRequest optimizationRequest = routePlanStopFactory.toOptimizationRequest(request);
        return ResponseEntity.ok(routeOptimizationService.optimizeRoute(optimizationRequest));
    }

    @ExceptionHandler(InvalidOptimizationRequestException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(InvalidOptimizationRequestException e) {
        logger.warn("Rejected optimization request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiError.of(e.getMessage()));
    }

    private ResponseEntity<OptimizedRoute> handleWithKafka(OptimizationRequest request) {
        String jobId = optimizationJobProducer.submitOptimizationJob(request);

        Optional<OptimizationJobResult> result = jobTrackingService.waitForResult(jobId, jobTimeout);
        if (result.isEmpty()) {
            logger.warn("Job {} did not finish in {}, optimizing inline", jobId, jobTimeout);
            OptimizedRoute route = routeOptimizationService.optimizeRoute(request);
            route.getWarnings().add("Queued optimization timed out, computed inline");
            return ResponseEntity.ok(route);
        }

        OptimizationJobResult jobResult = result.get();
        if (!jobResult.isSuccess()) {
            throw new InvalidOptimizationRequestException(jobResult.getErrorMessage());
        }
        return ResponseEntity.ok(jobResult.getRoute());
    }
}
