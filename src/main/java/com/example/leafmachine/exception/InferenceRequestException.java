package com.example.leafmachine.exception;

/**
 * The inference service could not be reached or answered with a non-success status.
 * {@link #getStatusCode()} is {@code -1} when no HTTP response was received.
 */
public class InferenceRequestException extends AnnotationProcessingException {

    private final int statusCode;
    private final String responseBody;

    public InferenceRequestException(int statusCode, String responseBody) {
        super("Inference request failed with status " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public InferenceRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
