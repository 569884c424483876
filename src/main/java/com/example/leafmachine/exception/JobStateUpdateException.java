package com.example.leafmachine.exception;

/**
 * The job-tracking endpoint rejected the running transition.
 */
public class JobStateUpdateException extends AnnotationProcessingException {

    public JobStateUpdateException(String message) {
        super(message);
    }

    public JobStateUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
