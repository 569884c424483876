package com.example.leafmachine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FailureRecord(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("errorMessage") String errorMessage) {
}
