package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single plant component found by the inference service. The bounding box is
 * {@code [x1, y1, x2, y2]} in source image pixels. Box values and score are kept exactly
 * as the model returned them, integers included.
 */
public record Detection(
        @JsonProperty("boundingBox") List<Number> boundingBox,
        @JsonProperty("class") String className,
        @JsonProperty("score") Double score) {

    public Detection {
        boundingBox = List.copyOf(boundingBox);
    }
}
