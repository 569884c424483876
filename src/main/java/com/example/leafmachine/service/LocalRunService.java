package com.example.leafmachine.service;

import com.example.leafmachine.config.LeafMachineProperties;
import com.example.leafmachine.exception.DigitalMediaRetrievalException;
import com.example.leafmachine.exception.InvalidJobRequestException;
import com.example.leafmachine.model.AnnotationEvent;
import com.example.leafmachine.model.DigitalObject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.UUID;

/**
 * Annotates a digital media record fetched from the DiSSCo API and returns the event
 * instead of publishing it. Job state is left untouched and a throwaway job id is used.
 * <p>
 * Only URLs under the configured DiSSCo API base are fetched.
 */
@Service
public class LocalRunService {

    private static final Logger log = LoggerFactory.getLogger(LocalRunService.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AnnotationPipeline pipeline;
    private final URI apiBase;

    public LocalRunService(RestTemplate restTemplate,
                           ObjectMapper objectMapper,
                           AnnotationPipeline pipeline,
                           LeafMachineProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.pipeline = pipeline;
        this.apiBase = withTrailingSlash(URI.create(properties.getLocalRun().getApiBase()).normalize());
    }

    public AnnotationEvent run(String digitalMediaUrl) {
        DigitalObject object = fetchDigitalMedia(requireUnderApiBase(digitalMediaUrl));
        AnnotationEvent event = pipeline.annotate(UUID.randomUUID().toString(), object);
        log.info("Created {} annotation(s) for {}", event.annotations().size(), digitalMediaUrl);
        return event;
    }

    private DigitalObject fetchDigitalMedia(URI digitalMediaUrl) {
        String body;
        try {
            body = restTemplate.getForObject(digitalMediaUrl, String.class);
        } catch (RestClientException ex) {
            throw new DigitalMediaRetrievalException("Unable to retrieve " + digitalMediaUrl + ": " + ex.getMessage(), ex);
        }
        if (body == null) {
            throw new DigitalMediaRetrievalException("Empty response for " + digitalMediaUrl);
        }
        JsonNode attributes;
        try {
            attributes = objectMapper.readTree(body).path("data").path("attributes");
        } catch (JsonProcessingException ex) {
            throw new DigitalMediaRetrievalException("Response for " + digitalMediaUrl + " is not JSON", ex);
        }
        if (!attributes.isObject()) {
            throw new InvalidJobRequestException("Response for " + digitalMediaUrl + " has no data.attributes");
        }
        return DigitalObject.fromAttributes(attributes);
    }

    private URI requireUnderApiBase(String digitalMediaUrl) {
        URI target;
        try {
            target = new URI(digitalMediaUrl).normalize();
        } catch (URISyntaxException ex) {
            throw new InvalidJobRequestException("Not a valid URL: " + digitalMediaUrl, ex);
        }
        boolean allowed = target.isAbsolute()
                && target.getRawUserInfo() == null
                && apiBase.getScheme().equalsIgnoreCase(target.getScheme())
                && apiBase.getHost() != null
                && apiBase.getHost().equalsIgnoreCase(target.getHost())
                && apiBase.getPort() == target.getPort()
                && target.getRawPath() != null
                && target.getRawPath().startsWith(apiBase.getRawPath());
        if (!allowed) {
            throw new InvalidJobRequestException("Digital media URL must be under " + apiBase + ": " + digitalMediaUrl);
        }
        return target;
    }

    private static URI withTrailingSlash(URI uri) {
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        return path.endsWith("/") ? uri : URI.create(uri.toString() + "/");
    }
}
