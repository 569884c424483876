package com.example.leafmachine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Request to annotate a single digital media record without publishing the result")
public record LocalRunRequest(
        @Schema(description = "Full URL of the digital media record in the DiSSCo API",
                example = "https://sandbox.dissco.tech/api/digital-media/v1/SANDBOX/TC9-7ER-QVP")
        @NotBlank String digitalMediaUrl) {
}
