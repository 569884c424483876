package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Textual body of an annotation. {@code values} holds a single entry: either the
 * serialized detection or a free-text comment.
 */
public record AnnotationBody(
        @JsonProperty("oa:value") List<String> values,
        @JsonProperty("dcterms:references") String references) {

    public static final String TYPE = "oa:TextualBody";

    public AnnotationBody {
        values = List.copyOf(values);
    }

    public static AnnotationBody of(String value, String references) {
        return new AnnotationBody(List.of(value), references);
    }

    @JsonProperty("@type")
    public String type() {
        return TYPE;
    }
}
