package com.phillippitts.scalogram.service.io;

import com.phillippitts.scalogram.domain.ScalogramImage;

/**
 * Receives rendered scalograms.
 *
 * <p>Called concurrently from batch worker threads; implementations must be thread-safe.
 */
@FunctionalInterface
public interface ScalogramSink {

    /** Sink that discards every image. */
    ScalogramSink NOOP = (identifier, image) -> { };

    /**
     * @param identifier identifier of the input the image was rendered from
     * @param image      rendered scalogram
     * @throws com.phillippitts.scalogram.exception.OutputFailureException if the image cannot be stored
     */
    void emit(String identifier, ScalogramImage image);
}
