package com.phillippitts.scalogram.service.orchestration;

import com.phillippitts.scalogram.domain.ProcessingResult;
import com.phillippitts.scalogram.service.io.SignalSource;

import java.util.List;

/**
 * Runs load, transform, render and emit for every input of a batch.
 *
 * <p>A failing input never stops the batch: it yields a
 * {@link ProcessingResult.Failure} and the remaining inputs carry on.
 *
 * @since 1.0
 */
public interface BatchOrchestrator {

    /**
     * Processes every source.
     *
     * @param sources inputs, in batch order
     * @return exactly one result per source, in the same order
     */
    default List<ProcessingResult> processAll(List<? extends SignalSource> sources) {
        return processAll(sources, new BatchCancellation());
    }

    /**
     * Processes every source until the token is cancelled.
     *
     * @param sources      inputs, in batch order
     * @param cancellation token checked before each input starts
     * @return exactly one result per source, in the same order
     */
    List<ProcessingResult> processAll(List<? extends SignalSource> sources, BatchCancellation cancellation);
}
