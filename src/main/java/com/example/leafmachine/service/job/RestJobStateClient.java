package com.example.leafmachine.service.job;

import com.example.leafmachine.config.LeafMachineProperties;
import com.example.leafmachine.exception.JobStateUpdateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Service
public class RestJobStateClient implements JobStateClient {

    private static final Logger log = LoggerFactory.getLogger(RestJobStateClient.class);

    private final RestTemplate restTemplate;
    private final String runningEndpoint;
    private final String masId;

    public RestJobStateClient(RestTemplate restTemplate, LeafMachineProperties properties) {
        this.restTemplate = restTemplate;
        this.runningEndpoint = properties.getJob().getRunningEndpoint();
        this.masId = properties.getMas().getId();
    }

    @Override
    public void markRunning(String jobId) {
        if (!StringUtils.hasText(runningEndpoint)) {
            log.warn("No running endpoint configured, job {} is not marked as running", jobId);
            return;
        }
        String url = StringUtils.trimTrailingCharacter(runningEndpoint, '/') + "/{masId}/{jobId}/running";
        try {
            ResponseEntity<Void> response = restTemplate.getForEntity(url, Void.class, masId, jobId);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new JobStateUpdateException("Job " + jobId + " could not be marked as running: status "
                        + response.getStatusCode().value());
            }
        } catch (RestClientException ex) {
            throw new JobStateUpdateException("Job " + jobId + " could not be marked as running: " + ex.getMessage(), ex);
        }
        log.debug("Marked job {} as running", jobId);
    }
}
