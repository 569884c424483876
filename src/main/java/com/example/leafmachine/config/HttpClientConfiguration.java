package com.example.leafmachine.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Shared HTTP client for the inference service, the job-tracking endpoint and the
 * digital media API. Timeouts live here; the pipeline itself enforces none.
 */
@Configuration
public class HttpClientConfiguration {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, LeafMachineProperties properties) {
        LeafMachineProperties.Inference inference = properties.getInference();
        return builder
                .setConnectTimeout(inference.getConnectTimeout())
                .setReadTimeout(inference.getReadTimeout())
                .build();
    }
}
