package com.example.leafmachine.exception;

public class InvalidJobRequestException extends AnnotationProcessingException {

    public InvalidJobRequestException(String message) {
        super(message);
    }

    public InvalidJobRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
