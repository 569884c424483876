package com.example.leafmachine.model;

/**
 * An inbound annotation job. {@code object} is {@code null} when the message carried no
 * readable digital object; the pipeline reports that as a failed job.
 */
public record JobRequest(String jobId, DigitalObject object) {
}
