package com.example.leafmachine.exception;

public class MissingTargetIdentifierException extends AnnotationProcessingException {

    public MissingTargetIdentifierException(String message) {
        super(message);
    }
}
