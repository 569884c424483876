package com.example.leafmachine.model;

import java.util.List;

public record InferenceResult(List<Detection> detections, int imageHeight, int imageWidth) {

    public InferenceResult {
        detections = List.copyOf(detections);
    }
}
