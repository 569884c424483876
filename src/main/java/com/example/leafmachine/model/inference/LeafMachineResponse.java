package com.example.leafmachine.model.inference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire format returned by the LeafMachine {@code process_image} endpoint. Only the fields
 * the connector reads are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LeafMachineResponse(
        @JsonProperty("detections") List<LeafMachineDetection> detections,
        @JsonProperty("metadata") Metadata metadata) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LeafMachineDetection(
            @JsonProperty("bbox") List<Number> bbox,
            @JsonProperty("class_name") String className,
            @JsonProperty("confidence") Double confidence) {
    }

    /**
     * @param originalImageShape {@code [height, width, channels]} of the processed image
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(@JsonProperty("orig_img_shape") List<Double> originalImageShape) {
    }
}
