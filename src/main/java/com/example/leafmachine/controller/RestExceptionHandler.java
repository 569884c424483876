package com.example.leafmachine.controller;

import com.example.leafmachine.exception.DigitalMediaRetrievalException;
import com.example.leafmachine.exception.InferenceRequestException;
import com.example.leafmachine.exception.InferenceResponseException;
import com.example.leafmachine.exception.InvalidJobRequestException;
import com.example.leafmachine.exception.MissingTargetIdentifierException;
import com.example.leafmachine.model.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler({MissingTargetIdentifierException.class, InvalidJobRequestException.class})
    public ResponseEntity<ErrorResponse> handleInvalidTarget(RuntimeException exception, HttpServletRequest request) {
        return buildResponse(HttpStatus.BAD_REQUEST, exception.getMessage(), request);
    }

    @ExceptionHandler({InferenceRequestException.class, InferenceResponseException.class, DigitalMediaRetrievalException.class})
    public ResponseEntity<ErrorResponse> handleUpstream(RuntimeException exception, HttpServletRequest request) {
        log.error("Upstream call failed for {}", request.getRequestURI(), exception);
        return buildResponse(HttpStatus.BAD_GATEWAY, exception.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String message, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(), message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
