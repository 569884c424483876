package com.example.leafmachine.exception;

/**
 * The inference service answered successfully but the payload lacks usable detections or image shape.
 */
public class InferenceResponseException extends AnnotationProcessingException {

    public InferenceResponseException(String message) {
        super(message);
    }

    public InferenceResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
