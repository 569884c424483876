package com.example.leafmachine.messaging;

import com.example.leafmachine.model.FailureRecord;
import com.example.leafmachine.model.JobRequest;
import com.example.leafmachine.model.ProcessingResult;
import com.example.leafmachine.service.AnnotationPipeline;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnnotationJobListenerTest {

    @Mock
    private AnnotationPipeline pipeline;

    private AnnotationJobListener listener;

    @BeforeEach
    void setUp() {
        listener = new AnnotationJobListener(pipeline, Jackson2ObjectMapperBuilder.json()
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build());
    }

    @Test
    void parsesJobAndDigitalObject() {
        Optional<JobRequest> request = listener.parse("""
                {"jobId":"J1","object":{"id":"X1","type":"Specimen","ac:accessURI":"img1","dcterms:license":"CC0"}}
                """);

        assertThat(request).isPresent();
        assertThat(request.get().jobId()).isEqualTo("J1");
        assertThat(request.get().object().id()).isEqualTo("X1");
        assertThat(request.get().object().type()).isEqualTo("Specimen");
        assertThat(request.get().object().accessUri()).isEqualTo("img1");
    }

    @Test
    void prefersOpenDsIdentifierKeys() {
        Optional<JobRequest> request = listener.parse("""
                {"jobId":"J1","object":{"@id":"https://doi.org/TEST/X1","id":"X1","@type":"ods:DigitalMedia","ac:accessURI":"img1"}}
                """);

        assertThat(request).isPresent();
        assertThat(request.get().object().id()).isEqualTo("https://doi.org/TEST/X1");
        assertThat(request.get().object().type()).isEqualTo("ods:DigitalMedia");
    }

    @Test
    void handsParsedJobToPipeline() {
        when(pipeline.process(any())).thenReturn(new ProcessingResult.Failed(new FailureRecord("J1", "boom")));

        listener.onMessage("{\"jobId\":\"J1\",\"object\":{\"id\":\"X1\",\"type\":\"Specimen\",\"ac:accessURI\":\"img1\"}}");

        ArgumentCaptor<JobRequest> captor = ArgumentCaptor.forClass(JobRequest.class);
        verify(pipeline).process(captor.capture());
        assertThat(captor.getValue().jobId()).isEqualTo("J1");
    }

    @Test
    void discardsUnreadableMessage() {
        listener.onMessage("not json at all");

        verifyNoInteractions(pipeline);
    }

    @Test
    void discardsMessageWithoutJobId() {
        listener.onMessage("{\"object\":{\"id\":\"X1\"}}");

        verifyNoInteractions(pipeline);
    }

    @Test
    void malformedObjectStillReachesPipelineWithJobId() {
        when(pipeline.process(any())).thenReturn(new ProcessingResult.Failed(new FailureRecord("J1", "no object")));

        listener.onMessage("{\"jobId\":\"J1\",\"object\":\"not-an-object\"}");

        ArgumentCaptor<JobRequest> captor = ArgumentCaptor.forClass(JobRequest.class);
        verify(pipeline).process(captor.capture());
        assertThat(captor.getValue().jobId()).isEqualTo("J1");
        assertThat(captor.getValue().object()).isNull();
    }

    @Test
    void arrayOrMissingObjectYieldsRequestWithoutObject() {
        assertThat(listener.parse("{\"jobId\":\"J1\",\"object\":[1,2]}"))
                .hasValueSatisfying(request -> assertThat(request.object()).isNull());
        assertThat(listener.parse("{\"jobId\":\"J2\"}"))
                .hasValueSatisfying(request -> assertThat(request.object()).isNull());
    }

    @Test
    void mistypedFieldsAreLeftEmpty() {
        Optional<JobRequest> request = listener.parse(
                "{\"jobId\":\"J1\",\"object\":{\"id\":\"X1\",\"type\":\"Specimen\",\"ac:accessURI\":42}}");

        assertThat(request).isPresent();
        assertThat(request.get().object().id()).isEqualTo("X1");
        assertThat(request.get().object().accessUri()).isNull();
    }

    @Test
    void discardsMessageWithNonTextJobId() {
        listener.onMessage("{\"jobId\":17,\"object\":{\"id\":\"X1\"}}");

        verifyNoInteractions(pipeline);
    }
}
