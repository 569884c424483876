package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Software agent credited as the creator of every annotation this service produces.
 */
public record Agent(
        @JsonProperty("@id") String id,
        @JsonProperty("@type") String type,
        @JsonProperty("schema:name") String name,
        @JsonProperty("ods:hasRoles") List<Role> roles) {

    public static final String HANDLE_PREFIX = "https://hdl.handle.net/";
    public static final String APPLICATION_TYPE = "as:Application";
    public static final String MAS_ROLE = "machine-annotation-service";

    public Agent {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public static Agent machineAnnotationService(String masId, String name) {
        if (masId == null || masId.isBlank()) {
            throw new IllegalArgumentException("Machine annotation service id must be configured");
        }
        return new Agent(HANDLE_PREFIX + masId, APPLICATION_TYPE, name, List.of(new Role("schema:Role", MAS_ROLE)));
    }

    public record Role(
            @JsonProperty("@type") String type,
            @JsonProperty("schema:roleName") String roleName) {
    }
}
