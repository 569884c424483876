package com.example.leafmachine.controller;

import com.example.leafmachine.model.AnnotationEvent;
import com.example.leafmachine.model.LocalRunRequest;
import com.example.leafmachine.service.LocalRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/local-runs")
@Tag(name = "Local run", description = "Annotate a single record without touching Kafka")
public class LocalRunController {

    private final LocalRunService service;

    public LocalRunController(LocalRunService service) {
        this.service = service;
    }

    @Operation(
            summary = "Run LeafMachine on a digital media record",
            description = "Fetches the record, runs plant component detection and returns the annotation event that would have been published.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Annotations created",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = AnnotationEvent.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or digital media record", content = @Content),
            @ApiResponse(responseCode = "502", description = "Digital media API or inference service failed", content = @Content)
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AnnotationEvent> run(@Valid @RequestBody LocalRunRequest request) {
        return ResponseEntity.ok(service.run(request.digitalMediaUrl()));
    }
}
