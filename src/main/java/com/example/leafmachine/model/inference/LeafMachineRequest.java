package com.example.leafmachine.model.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LeafMachineRequest(
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("model_name") String modelName) {
}
