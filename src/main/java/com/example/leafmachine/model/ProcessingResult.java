package com.example.leafmachine.model;

/**
 * Terminal outcome of one job message: either the annotation event was published or a
 * failure record was sent instead. Never both.
 */
public sealed interface ProcessingResult permits ProcessingResult.Published, ProcessingResult.Failed {

    String jobId();

    record Published(AnnotationEvent event) implements ProcessingResult {

        @Override
        public String jobId() {
            return event.jobId();
        }
    }

    record Failed(FailureRecord failure) implements ProcessingResult {

        @Override
        public String jobId() {
            return failure.jobId();
        }
    }
}
