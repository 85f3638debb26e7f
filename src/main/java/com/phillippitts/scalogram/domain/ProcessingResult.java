package com.phillippitts.scalogram.domain;

import com.phillippitts.scalogram.exception.ErrorKind;

import java.util.Objects;

/**
 * Outcome of processing one input of a batch.
 *
 * <p>{@link #index()} is the input's position in the batch; result lists are ordered by it.
 */
public sealed interface ProcessingResult permits ProcessingResult.Success, ProcessingResult.Failure {

    int index();

    String identifier();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * The input was rendered and handed to the output sink.
     *
     * @param index      position in the batch
     * @param identifier input identifier
     * @param image      rendered scalogram
     */
    record Success(int index, String identifier, ScalogramImage image) implements ProcessingResult {
        public Success {
            Objects.requireNonNull(identifier, "identifier must not be null");
            Objects.requireNonNull(image, "image must not be null");
        }
    }

    /**
     * The input failed at one stage; later stages were skipped.
     *
     * @param index      position in the batch
     * @param identifier input identifier
     * @param stage      stage that failed
     * @param errorKind  classification of the failure
     * @param reason     human-readable cause
     */
    record Failure(int index, String identifier, PipelineStage stage, ErrorKind errorKind, String reason)
            implements ProcessingResult {
        public Failure {
            Objects.requireNonNull(identifier, "identifier must not be null");
            Objects.requireNonNull(stage, "stage must not be null");
            Objects.requireNonNull(errorKind, "errorKind must not be null");
            reason = reason == null ? errorKind.getDisplayName() : reason;
        }
    }
}
