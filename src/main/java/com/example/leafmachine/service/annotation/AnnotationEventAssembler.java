package com.example.leafmachine.service.annotation;

import com.example.leafmachine.model.Annotation;
import com.example.leafmachine.model.AnnotationEvent;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AnnotationEventAssembler {

    public AnnotationEvent assemble(List<Annotation> annotations, String jobId) {
        return new AnnotationEvent(annotations, jobId);
    }
}
