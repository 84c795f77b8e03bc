package com.translogistics.router.service;

import com.translogistics.router.dto.OptimizationJobMessage;
import com.translogistics.router.dto.OptimizationJobResult;
import com.translogistics.router.dto.OptimizedRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Service;

@Service
public class OptimizationJobConsumer {

    private static final Logger logger = LoggerFactory.getLogger(OptimizationJobConsumer.class);

    @Autowired
    private RouteOptimizationService routeOptimizationService;

    @Autowired
    private JobTrackingService jobTrackingService;

    @KafkaListener(topics = OptimizationJobProducer.TOPIC)
    public void processJob(OptimizationJobMessage message,
                           @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
                           Acknowledgment ack) {

        String jobId = message.getJobId();
        logger.info("Processing job {} (partition: {})", jobId, partition);

        try {
            OptimizedRoute route = routeOptimizationService.optimizeRoute(message.getRequest());
            jobTrackingService.addResult(OptimizationJobResult.completed(jobId, route));
        } catch (RuntimeException e) {
            logger.error("Failed to process job {}: {}", jobId, e.getMessage());
            jobTrackingService.addResult(OptimizationJobResult.failed(jobId, e.getMessage()));
        } finally {
            ack.acknowledge();
        }
    }
}
