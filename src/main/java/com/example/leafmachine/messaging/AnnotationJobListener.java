package com.example.leafmachine.messaging;

import com.example.leafmachine.model.DigitalObject;
import com.example.leafmachine.model.JobRequest;
import com.example.leafmachine.model.ProcessingResult;
import com.example.leafmachine.service.AnnotationPipeline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Consumes job requests one at a time and hands them to the {@link AnnotationPipeline}.
 */
@Component
public class AnnotationJobListener {

    private static final Logger log = LoggerFactory.getLogger(AnnotationJobListener.class);

    private final AnnotationPipeline pipeline;
    private final ObjectMapper objectMapper;

    public AnnotationJobListener(AnnotationPipeline pipeline, ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
    }

    @KafkaListener(
            topics = "${leafmachine.kafka.consumer-topic}",
            groupId = "${leafmachine.kafka.consumer-group}",
            concurrency = "1")
    public void onMessage(String message) {
        log.info("Received message: {}", message);
        parse(message).ifPresent(request -> {
            ProcessingResult result = pipeline.process(request);
            log.debug("Job {} finished as {}", result.jobId(), result.getClass().getSimpleName());
        });
    }

    /**
     * Reads the job id and digital object. Only a message without a usable job id is
     * discarded; an unreadable object still yields a request so the job is reported as failed.
     */
    Optional<JobRequest> parse(String message) {
        JsonNode root;
        try {
            root = objectMapper.readTree(message);
        } catch (JsonProcessingException ex) {
            // no job id to report against, so nothing goes to the failure topic
            log.error("Discarding unreadable job message: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
        JsonNode jobId = root.path("jobId");
        if (!jobId.isTextual() || !StringUtils.hasText(jobId.asText())) {
            log.error("Discarding job message without jobId: {}", message);
            return Optional.empty();
        }
        JsonNode object = root.path("object");
        if (!object.isObject()) {
            log.warn("Job {} carries no digital object", jobId.asText());
            return Optional.of(new JobRequest(jobId.asText(), null));
        }
        return Optional.of(new JobRequest(jobId.asText(), DigitalObject.fromAttributes(object)));
    }
}
