package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnnotationTarget(
        @JsonProperty("@id") String id,
        @JsonProperty("@type") String type,
        @JsonProperty("oa:hasSelector") FragmentSelector selector) {

    @JsonProperty("dcterms:identifier")
    public String identifier() {
        return id;
    }
}
