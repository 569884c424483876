package com.example.leafmachine.service.job;

/**
 * External job tracker. The connector only reports that it picked a job up; completion
 * is derived downstream from the published event or failure record.
 */
public interface JobStateClient {

    /**
     * @throws com.example.leafmachine.exception.JobStateUpdateException when the tracker rejects the update
     */
    void markRunning(String jobId);
}
