package com.example.leafmachine.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The specimen or media record an annotation targets. Identifier and type are read from
 * the openDS keys first and fall back to the older and the plain spellings.
 */
public record DigitalObject(String id, String type, String accessUri) {

    private static final List<String> ID_KEYS = List.of("@id", "dcterms:identifier", "ods:ID", "id");
    private static final List<String> TYPE_KEYS = List.of("@type", "ods:type", "type");
    private static final List<String> ACCESS_URI_KEYS = List.of("ac:accessURI");

    /**
     * Reads the object from its JSON attributes. Keys that are absent or not text are
     * left {@code null}; whether the result is usable is decided by the caller.
     */
    public static DigitalObject fromAttributes(JsonNode attributes) {
        return new DigitalObject(
                firstText(attributes, ID_KEYS),
                firstText(attributes, TYPE_KEYS),
                firstText(attributes, ACCESS_URI_KEYS));
    }

    public boolean hasTargetIdentifiers() {
        return id != null && !id.isBlank() && type != null && !type.isBlank();
    }

    private static String firstText(JsonNode attributes, List<String> keys) {
        for (String key : keys) {
            JsonNode value = attributes.path(key);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
