package com.example.leafmachine.service.inference;

import com.example.leafmachine.model.InferenceResult;

/**
 * Runs plant component detection on a remote image. Implementations make exactly one
 * call per invocation: no retries and no caching.
 */
public interface InferenceClient {

    /**
     * @param imageUri  location the inference service downloads the image from
     * @param modelName name of the detection model to run
     * @return detections in the order the service returned them, plus the processed image size
     * @throws com.example.leafmachine.exception.InferenceRequestException  when the call fails or returns a non-success status
     * @throws com.example.leafmachine.exception.InferenceResponseException when the response lacks detections or image shape
     */
    InferenceResult invoke(String imageUri, String modelName);

    InferenceResult invoke(String imageUri);
}
