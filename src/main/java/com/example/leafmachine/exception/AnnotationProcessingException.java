package com.example.leafmachine.exception;

/**
 * Base type for every error that can abort the processing of a single job message.
 */
public class AnnotationProcessingException extends RuntimeException {

    public AnnotationProcessingException(String message) {
        super(message);
    }

    public AnnotationProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
