package com.translogistics.router.service;

import com.translogistics.router.dto.OptimizationJobResult;
import com.translogistics.router.dto.OptimizedRoute;
import com.translogistics.router.model.OptimizationMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobTrackingServiceTest {

    private JobTrackingService jobTrackingService;

    @BeforeEach
    void setUp() {
        jobTrackingService = new JobTrackingService();
    }

    @Test
    void shouldReturnCompletedResult() {
        String jobId = "test-job-1";
        jobTrackingService.createJob(jobId);

        OptimizedRoute route = OptimizedRoute.builder()
                .totalDistanceKm(12.5)
                .optimizationMethod(OptimizationMethod.HEURISTIC)
                .build();
        jobTrackingService.addResult(OptimizationJobResult.completed(jobId, route));

        Optional<OptimizationJobResult> result = jobTrackingService.waitForResult(jobId, Duration.ofSeconds(1));

        assertTrue(result.isPresent());
        assertTrue(result.get().isSuccess());
        assertEquals(12.5, result.get().getRoute().getTotalDistanceKm());
        assertEquals(0, jobTrackingService.activeJobs());
    }

    @Test
    void shouldWakeWaiterWhenResultArrivesLater() throws Exception {
        String jobId = "test-job-2";
        jobTrackingService.createJob(jobId);

        CompletableFuture<Optional<OptimizationJobResult>> waiter = CompletableFuture.supplyAsync(
                () -> jobTrackingService.waitForResult(jobId, Duration.ofSeconds(5)));
        Thread.sleep(100);
        jobTrackingService.addResult(OptimizationJobResult.failed(jobId, "bad request"));

        Optional<OptimizationJobResult> result = waiter.get(5, TimeUnit.SECONDS);

        assertTrue(result.isPresent());
        assertFalse(result.get().isSuccess());
        assertEquals("bad request", result.get().getErrorMessage());
    }

    @Test
    void shouldTimeout() {
        String jobId = "test-job-3";
        jobTrackingService.createJob(jobId);

        Optional<OptimizationJobResult> result = jobTrackingService.waitForResult(jobId, Duration.ofMillis(100));

        assertTrue(result.isEmpty());
        assertEquals(0, jobTrackingService.activeJobs());
    }

    @Test
    void shouldIgnoreResultForUnknownJob() {
        jobTrackingService.addResult(OptimizationJobResult.failed("missing", "late"));

        assertTrue(jobTrackingService.waitForResult("missing", Duration.ofMillis(10)).isEmpty());
        assertEquals(0, jobTrackingService.activeJobs());
    }
}
