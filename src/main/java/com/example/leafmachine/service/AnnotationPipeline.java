package com.example.leafmachine.service;

import com.example.leafmachine.exception.InvalidJobRequestException;
import com.example.leafmachine.messaging.AnnotationPublisher;
import com.example.leafmachine.model.Agent;
import com.example.leafmachine.model.Annotation;
import com.example.leafmachine.model.AnnotationEvent;
import com.example.leafmachine.model.DigitalObject;
import com.example.leafmachine.model.FailureRecord;
import com.example.leafmachine.model.InferenceResult;
import com.example.leafmachine.model.JobRequest;
import com.example.leafmachine.model.ProcessingResult;
import com.example.leafmachine.model.ProcessingResult.Failed;
import com.example.leafmachine.model.ProcessingResult.Published;
import com.example.leafmachine.service.annotation.AnnotationEventAssembler;
import com.example.leafmachine.service.annotation.AnnotationMapper;
import com.example.leafmachine.service.inference.InferenceClient;
import com.example.leafmachine.service.job.JobStateClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Processes one job message from intake to publish.
 * <p>
 * The job is marked running before any inference work. Every error raised afterwards,
 * including a failed publish of the event, is caught here once and turned into a
 * {@link FailureRecord} on the failure topic. An event is either published whole or not
 * at all.
 */
@Service
public class AnnotationPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnnotationPipeline.class);

    private final JobStateClient jobStateClient;
    private final InferenceClient inferenceClient;
    private final AnnotationMapper mapper;
    private final AnnotationEventAssembler assembler;
    private final AnnotationPublisher publisher;
    private final Agent agent;
    private final Clock clock;

    public AnnotationPipeline(JobStateClient jobStateClient,
                              InferenceClient inferenceClient,
                              AnnotationMapper mapper,
                              AnnotationEventAssembler assembler,
                              AnnotationPublisher publisher,
                              Agent agent,
                              Clock clock) {
        this.jobStateClient = jobStateClient;
        this.inferenceClient = inferenceClient;
        this.mapper = mapper;
        this.assembler = assembler;
        this.publisher = publisher;
        this.agent = agent;
        this.clock = clock;
    }

    /**
     * Runs the job and publishes its outcome. A failure to publish the failure record
     * itself propagates to the caller.
     */
    public ProcessingResult process(JobRequest request) {
        String jobId = request.jobId();
        try {
            jobStateClient.markRunning(jobId);
            AnnotationEvent event = annotate(jobId, request.object());
            publisher.publishEvent(event);
            log.info("Published {} annotation(s) for job {}", event.annotations().size(), jobId);
            return new Published(event);
        } catch (RuntimeException ex) {
            log.error("Failed to process job {}", jobId, ex);
            FailureRecord failure = new FailureRecord(jobId, describe(ex));
            publisher.publishFailure(failure);
            return new Failed(failure);
        }
    }

    /**
     * Runs inference on the object's image and maps the result without publishing it.
     */
    public AnnotationEvent annotate(String jobId, DigitalObject object) {
        if (object == null) {
            throw new InvalidJobRequestException("Job " + jobId + " does not reference a digital object");
        }
        if (!StringUtils.hasText(object.accessUri())) {
            throw new InvalidJobRequestException("Digital object " + object.id() + " has no ac:accessURI");
        }

        InferenceResult result = inferenceClient.invoke(object.accessUri());
        Instant timestamp = Instant.now(clock);

        List<Annotation> annotations;
        if (result.detections().isEmpty()) {
            log.info("No results for this herbarium sheet: {} - jobId: {}", object.accessUri(), jobId);
            annotations = List.of(mapper.mapNoDetections(
                    object, result.imageHeight(), result.imageWidth(), agent, timestamp));
        } else {
            annotations = mapper.mapDetections(
                    object, result.detections(), result.imageHeight(), result.imageWidth(), agent, timestamp);
        }
        return assembler.assemble(annotations, jobId);
    }

    private String describe(RuntimeException ex) {
        return StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getName();
    }
}
