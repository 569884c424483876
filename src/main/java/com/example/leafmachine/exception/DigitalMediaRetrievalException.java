package com.example.leafmachine.exception;

public class DigitalMediaRetrievalException extends AnnotationProcessingException {

    public DigitalMediaRetrievalException(String message) {
        super(message);
    }

    public DigitalMediaRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
