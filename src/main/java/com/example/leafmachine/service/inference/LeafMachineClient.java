package com.example.leafmachine.service.inference;

import com.example.leafmachine.config.LeafMachineProperties;
import com.example.leafmachine.exception.InferenceRequestException;
import com.example.leafmachine.exception.InferenceResponseException;
import com.example.leafmachine.model.Detection;
import com.example.leafmachine.model.InferenceResult;
import com.example.leafmachine.model.inference.LeafMachineRequest;
import com.example.leafmachine.model.inference.LeafMachineResponse;
import com.example.leafmachine.model.inference.LeafMachineResponse.LeafMachineDetection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Client for the LeafMachine {@code process_image} endpoint hosted at IDLab.
 */
@Service
public class LeafMachineClient implements InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(LeafMachineClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String defaultModelName;

    public LeafMachineClient(RestTemplate restTemplate, ObjectMapper objectMapper, LeafMachineProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoint = properties.getInference().getEndpoint();
        this.defaultModelName = properties.getInference().getModelName();
    }

    @Override
    public InferenceResult invoke(String imageUri) {
        return invoke(imageUri, defaultModelName);
    }

    @Override
    public InferenceResult invoke(String imageUri, String modelName) {
        String model = modelName == null || modelName.isBlank() ? defaultModelName : modelName;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<LeafMachineRequest> request = new HttpEntity<>(new LeafMachineRequest(imageUri, model), headers);

        log.debug("Requesting {} inference for {}", model, imageUri);
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(endpoint, HttpMethod.POST, request, String.class);
        } catch (RestClientResponseException ex) {
            throw new InferenceRequestException(ex.getStatusCode().value(), ex.getResponseBodyAsString());
        } catch (RestClientException ex) {
            throw new InferenceRequestException("Inference request to " + endpoint + " failed: " + ex.getMessage(), ex);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new InferenceRequestException(response.getStatusCode().value(), response.getBody());
        }
        return toResult(parse(response.getBody()));
    }

    private LeafMachineResponse parse(String body) {
        if (body == null || body.isBlank()) {
            throw new InferenceResponseException("Inference service returned an empty body");
        }
        try {
            return objectMapper.readValue(body, LeafMachineResponse.class);
        } catch (JsonProcessingException ex) {
            throw new InferenceResponseException("Inference response is not valid: " + ex.getOriginalMessage(), ex);
        }
    }

    private InferenceResult toResult(LeafMachineResponse response) {
        if (response.metadata() == null) {
            throw new InferenceResponseException("Inference response has no metadata");
        }
        List<Double> shape = response.metadata().originalImageShape();
        if (shape == null || shape.size() < 2 || shape.get(0) == null || shape.get(1) == null) {
            throw new InferenceResponseException("Inference response has no usable orig_img_shape: " + shape);
        }
        int height = shape.get(0).intValue();
        int width = shape.get(1).intValue();
        if (height <= 0 || width <= 0) {
            throw new InferenceResponseException("Inference response reports an empty image: " + shape);
        }

        List<LeafMachineDetection> raw = response.detections() == null ? List.of() : response.detections();
        List<Detection> detections = new ArrayList<>(raw.size());
        for (LeafMachineDetection detection : raw) {
            if (detection == null) {
                throw new InferenceResponseException("Inference response contains an empty detection");
            }
            List<Number> box = detection.bbox();
            if (box == null || box.size() != 4 || box.contains(null)) {
                throw new InferenceResponseException("Detection has an invalid bbox: " + box);
            }
            detections.add(new Detection(box, detection.className(), detection.confidence()));
        }
        log.debug("Inference returned {} detections for a {}x{} image", detections.size(), width, height);
        return new InferenceResult(detections, height, width);
    }
}
