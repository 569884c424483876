package com.example.leafmachine.service.annotation;

import com.example.leafmachine.config.LeafMachineProperties;
import com.example.leafmachine.exception.MissingTargetIdentifierException;
import com.example.leafmachine.model.Agent;
import com.example.leafmachine.model.Annotation;
import com.example.leafmachine.model.AnnotationBody;
import com.example.leafmachine.model.AnnotationTarget;
import com.example.leafmachine.model.Detection;
import com.example.leafmachine.model.DigitalObject;
import com.example.leafmachine.model.FragmentSelector;
import com.example.leafmachine.model.Motivation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns LeafMachine results into openDS annotations on a digital object.
 * <p>
 * Callers sample the timestamp once per job and hand the same value to every call so all
 * annotations of one job share their creation time.
 */
@Component
public class AnnotationMapper {

    public static final String NO_DETECTIONS_MESSAGE = "Leafpriority model found no plant components in this image";

    private final FragmentSelectorFactory selectorFactory;
    private final ObjectMapper objectMapper;
    private final String modelReference;

    public AnnotationMapper(FragmentSelectorFactory selectorFactory,
                            ObjectMapper objectMapper,
                            LeafMachineProperties properties) {
        this.selectorFactory = selectorFactory;
        this.objectMapper = objectMapper;
        this.modelReference = properties.getInference().getModelReference();
    }

    public List<Annotation> mapDetections(DigitalObject target,
                                          List<Detection> detections,
                                          int imageHeight,
                                          int imageWidth,
                                          Agent agent,
                                          Instant timestamp) {
        List<Annotation> annotations = new ArrayList<>(detections.size());
        for (Detection detection : detections) {
            FragmentSelector selector = selectorFactory.fromDetectionBox(detection.boundingBox(), imageWidth, imageHeight);
            annotations.add(mapDetection(agent, timestamp, detection, selector, target.id(), target.type(), modelReference));
        }
        return annotations;
    }

    public Annotation mapNoDetections(DigitalObject target,
                                      int imageHeight,
                                      int imageWidth,
                                      Agent agent,
                                      Instant timestamp) {
        FragmentSelector selector = selectorFactory.fromFullImage(imageWidth, imageHeight);
        return mapEmpty(agent, timestamp, NO_DETECTIONS_MESSAGE, selector, target.id(), target.type());
    }

    public Annotation mapDetection(Agent agent,
                                   Instant timestamp,
                                   Detection detection,
                                   FragmentSelector selector,
                                   String targetId,
                                   String targetType,
                                   String modelRef) {
        requireTarget(targetId, targetType);
        AnnotationBody body = AnnotationBody.of(toJson(detection), modelRef);
        return new Annotation(Motivation.CLASSIFYING, agent, timestamp,
                new AnnotationTarget(targetId, targetType, selector), body);
    }

    public Annotation mapEmpty(Agent agent,
                               Instant timestamp,
                               String message,
                               FragmentSelector selector,
                               String targetId,
                               String targetType) {
        requireTarget(targetId, targetType);
        AnnotationBody body = AnnotationBody.of(message, "");
        return new Annotation(Motivation.COMMENTING, agent, timestamp,
                new AnnotationTarget(targetId, targetType, selector), body);
    }

    private void requireTarget(String targetId, String targetType) {
        if (targetId == null || targetId.isBlank()) {
            throw new MissingTargetIdentifierException("Digital object has no identifier to annotate");
        }
        if (targetType == null || targetType.isBlank()) {
            throw new MissingTargetIdentifierException("Digital object " + targetId + " has no type");
        }
    }

    private String toJson(Detection detection) {
        try {
            return objectMapper.writeValueAsString(detection);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize detection " + detection, e);
        }
    }
}
