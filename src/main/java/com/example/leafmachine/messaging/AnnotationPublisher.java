package com.example.leafmachine.messaging;

import com.example.leafmachine.model.AnnotationEvent;
import com.example.leafmachine.model.FailureRecord;

/**
 * Outbound side of the queue. Both methods block until the broker confirms the send.
 * <p>
 * Delivery is at-least-once. A send that times out is reported as a failure, but the
 * broker may still accept the record afterwards, so a job can end up with both an
 * annotation event and a failure record. Consumers of both topics have to tolerate that.
 */
public interface AnnotationPublisher {

    /**
     * @throws com.example.leafmachine.exception.PublishException when the event could not be sent
     */
    void publishEvent(AnnotationEvent event);

    /**
     * @throws com.example.leafmachine.exception.PublishException when the record could not be sent
     */
    void publishFailure(FailureRecord failure);
}
