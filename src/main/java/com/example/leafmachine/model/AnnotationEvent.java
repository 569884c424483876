package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AnnotationEvent(
        @JsonProperty("annotations") List<Annotation> annotations,
        @JsonProperty("jobId") String jobId) {

    public AnnotationEvent {
        annotations = List.copyOf(annotations);
    }
}
