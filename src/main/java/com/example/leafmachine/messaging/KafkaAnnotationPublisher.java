package com.example.leafmachine.messaging;

import com.example.leafmachine.config.LeafMachineProperties;
import com.example.leafmachine.exception.PublishException;
import com.example.leafmachine.model.AnnotationEvent;
import com.example.leafmachine.model.FailureRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class KafkaAnnotationPublisher implements AnnotationPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaAnnotationPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String eventTopic;
    private final String failureTopic;
    private final Duration sendTimeout;

    public KafkaAnnotationPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                    ObjectMapper objectMapper,
                                    LeafMachineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.eventTopic = properties.getKafka().getProducerTopic();
        this.failureTopic = properties.getKafka().getFailureTopic();
        this.sendTimeout = properties.getKafka().getSendTimeout();
    }

    @Override
    public void publishEvent(AnnotationEvent event) {
        String payload = serialize(event);
        log.info("Publishing annotation event: {}", payload);
        send(eventTopic, event.jobId(), payload);
    }

    @Override
    public void publishFailure(FailureRecord failure) {
        String payload = serialize(failure);
        log.info("Publishing failure for job {} to {}", failure.jobId(), failureTopic);
        send(failureTopic, failure.jobId(), payload);
    }

    private void send(String topic, String key, String payload) {
        try {
            kafkaTemplate.send(topic, key, payload).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PublishException("Interrupted while publishing to " + topic, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new PublishException("Failed to publish to " + topic + ": " + cause.getMessage(), cause);
        } catch (TimeoutException ex) {
            throw new PublishException("Timed out after " + sendTimeout.toMillis() + " ms publishing to " + topic, ex);
        } catch (KafkaException ex) {
            throw new PublishException("Failed to publish to " + topic + ": " + ex.getMessage(), ex);
        }
    }

    private String serialize(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new PublishException("Unable to serialize " + message.getClass().getSimpleName(), ex);
        }
    }
}
