package com.example.leafmachine.service;

import com.example.leafmachine.config.LeafMachineProperties;
import com.example.leafmachine.exception.DigitalMediaRetrievalException;
import com.example.leafmachine.exception.InvalidJobRequestException;
import com.example.leafmachine.model.AnnotationEvent;
import com.example.leafmachine.model.DigitalObject;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class LocalRunServiceTest {

    private static final String MEDIA_URL = "https://sandbox.dissco.tech/api/digital-media/v1/SANDBOX/TC9-7ER-QVP";

    @Mock
    private AnnotationPipeline pipeline;

    private MockRestServiceServer server;
    private LocalRunService service;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        LeafMachineProperties properties = new LeafMachineProperties();
        properties.getLocalRun().setApiBase("https://sandbox.dissco.tech/api");
        service = new LocalRunService(restTemplate, Jackson2ObjectMapperBuilder.json()
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build(), pipeline, properties);
    }

    @Test
    void annotatesAttributesOfFetchedMedia() {
        server.expect(requestTo(MEDIA_URL)).andRespond(withSuccess("""
                {"data": {"id": "SANDBOX/TC9-7ER-QVP", "attributes": {
                   "@id": "https://doi.org/SANDBOX/TC9-7ER-QVP",
                   "@type": "ods:DigitalMedia",
                   "ac:accessURI": "https://images.example.org/sheet.jpg"}}}
                """, MediaType.APPLICATION_JSON));
        AnnotationEvent event = new AnnotationEvent(List.of(), "local");
        when(pipeline.annotate(anyString(), eq(new DigitalObject(
                "https://doi.org/SANDBOX/TC9-7ER-QVP", "ods:DigitalMedia", "https://images.example.org/sheet.jpg"))))
                .thenReturn(event);

        assertThat(service.run(MEDIA_URL)).isSameAs(event);

        ArgumentCaptor<String> jobId = ArgumentCaptor.forClass(String.class);
        verify(pipeline).annotate(jobId.capture(), eq(new DigitalObject(
                "https://doi.org/SANDBOX/TC9-7ER-QVP", "ods:DigitalMedia", "https://images.example.org/sheet.jpg")));
        assertThat(jobId.getValue()).isNotBlank();
    }

    @Test
    void unreachableMediaIsRetrievalError() {
        server.expect(requestTo(MEDIA_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> service.run(MEDIA_URL)).isInstanceOf(DigitalMediaRetrievalException.class);
        verifyNoInteractions(pipeline);
    }

    @Test
    void responseWithoutAttributesIsInvalid() {
        server.expect(requestTo(MEDIA_URL)).andRespond(withSuccess("{\"data\":{}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> service.run(MEDIA_URL)).isInstanceOf(InvalidJobRequestException.class);
        verifyNoInteractions(pipeline);
    }

    @Test
    void readsPlainIdentifierKeysFromAttributes() {
        server.expect(requestTo(MEDIA_URL)).andRespond(withSuccess("""
                {"data": {"attributes": {"id": "X1", "type": "Specimen", "ac:accessURI": "img1"}}}
                """, MediaType.APPLICATION_JSON));
        when(pipeline.annotate(anyString(), eq(new DigitalObject("X1", "Specimen", "img1"))))
                .thenReturn(new AnnotationEvent(List.of(), "local"));

        service.run(MEDIA_URL);

        verify(pipeline).annotate(anyString(), eq(new DigitalObject("X1", "Specimen", "img1")));
    }

    @Test
    void foreignHostIsRejectedWithoutFetching() {
        assertThatThrownBy(() -> service.run("http://169.254.169.254/latest/meta-data/"))
                .isInstanceOf(InvalidJobRequestException.class)
                .hasMessageContaining("https://sandbox.dissco.tech/api/");

        server.verify();
        verifyNoInteractions(pipeline);
    }

    @Test
    void pathEscapingTheApiBaseIsRejected() {
        assertThatThrownBy(() -> service.run("https://sandbox.dissco.tech/api/../admin/users"))
                .isInstanceOf(InvalidJobRequestException.class);

        verifyNoInteractions(pipeline);
    }

    @Test
    void lookalikeHostIsRejected() {
        assertThatThrownBy(() -> service.run("https://sandbox.dissco.tech@evil.example.org/api/digital-media/v1/X"))
                .isInstanceOf(InvalidJobRequestException.class);
        assertThatThrownBy(() -> service.run("https://sandbox.dissco.tech.evil.example.org/api/digital-media/v1/X"))
                .isInstanceOf(InvalidJobRequestException.class);

        verifyNoInteractions(pipeline);
    }
}
