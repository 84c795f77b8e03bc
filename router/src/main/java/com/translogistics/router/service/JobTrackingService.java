package com.translogistics.router.service;

import com.translogistics.router.dto.OptimizationJobResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-flight optimization jobs that were offloaded to Kafka, keyed by job id.
 */
@Service
public class JobTrackingService {

    private static final Logger logger = LoggerFactory.getLogger(JobTrackingService.class);

    private final Map<String, CountDownLatch> jobLatches = new ConcurrentHashMap<>();
    private final Map<String, OptimizationJobResult> jobResults = new ConcurrentHashMap<>();
    private final Map<String, Long> jobCreatedAt = new ConcurrentHashMap<>();

    public void createJob(String jobId) {
        jobLatches.put(jobId, new CountDownLatch(1));
        jobCreatedAt.put(jobId, System.currentTimeMillis());
        logger.info("Created optimization job {}", jobId);
    }

    public void addResult(OptimizationJobResult result) {
        String jobId = result.getJobId();
        CountDownLatch latch = jobLatches.get(jobId);

        if (latch == null) {
            logger.warn("Received result for unknown job: {}", jobId);
            return;
        }

        jobResults.put(jobId, result);
        latch.countDown();

        if (result.isSuccess()) {
            logger.info("Job {} completed with {} stops", jobId, result.getRoute().getOrderedStops().size());
        } else {
            logger.warn("Job {} failed: {}", jobId, result.getErrorMessage());
        }
    }

    /**
     * Blocks until the job has a result or the timeout elapses. The job is forgotten either way.
     *
     * @return the result, or empty on timeout, interruption or an unknown job id
     */
    public Optional<OptimizationJobResult> waitForResult(String jobId, Duration timeout) {
        CountDownLatch latch = jobLatches.get(jobId);
        if (latch == null) {
            logger.warn("Job {} not found", jobId);
            return Optional.empty();
        }

        try {
            boolean completed = latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                logger.warn("Job {} timed out after {} ms", jobId, timeout.toMillis());
                return Optional.empty();
            }
            return Optional.ofNullable(jobResults.get(jobId));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Job {} was interrupted", jobId);
            return Optional.empty();
        } finally {
            cleanup(jobId);
        }
    }

    public int activeJobs() {
        return jobLatches.size();
    }

    private void cleanup(String jobId) {
        jobLatches.remove(jobId);
        jobResults.remove(jobId);
        Long createdAt = jobCreatedAt.remove(jobId);
        if (createdAt != null) {
            logger.debug("Cleaned up job {} after {} ms", jobId, System.currentTimeMillis() - createdAt);
        }
    }
}
