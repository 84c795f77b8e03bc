package com.translogistics.router.service;

import com.translogistics.router.dto.OptimizationJobMessage;
import com.translogistics.router.dto.OptimizationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
public class OptimizationJobProducer {

    private static final Logger logger = LoggerFactory.getLogger(OptimizationJobProducer.class);
    public static final String TOPIC = "route-optimization-requests";

    @Autowired
    private KafkaTemplate<String, OptimizationJobMessage> kafkaTemplate;

    @Autowired
    private JobTrackingService jobTrackingService;

    public String submitOptimizationJob(OptimizationRequest request) {
        String jobId = UUID.randomUUID().toString();
        jobTrackingService.createJob(jobId);

        kafkaTemplate.send(TOPIC, jobId, new OptimizationJobMessage(jobId, request));
        logger.info("Submitted job {} with {} stops", jobId,
                request.getStops() != null ? request.getStops().size() : 0);

        return jobId;
    }
}
