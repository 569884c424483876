package com.example.leafmachine.exception;

public class PublishException extends AnnotationProcessingException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
