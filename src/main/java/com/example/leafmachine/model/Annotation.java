package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Annotation(
        @JsonProperty("oa:motivation") Motivation motivation,
        @JsonProperty("dcterms:creator") Agent creator,
        @JsonProperty("dcterms:created") Instant created,
        @JsonProperty("oa:hasTarget") AnnotationTarget target,
        @JsonProperty("oa:hasBody") AnnotationBody body) {

    public static final String TYPE = "ods:Annotation";

    @JsonProperty("@type")
    public String type() {
        return TYPE;
    }
}
