package com.phillippitts.scalogram.service.io;

import com.phillippitts.scalogram.domain.Signal;

/**
 * Supplies one signal to the batch pipeline.
 *
 * <p>{@link #load()} is called at most once per batch run, on a batch worker thread.
 */
public interface SignalSource {

    /**
     * @return name used in results, logs and output file names
     */
    String identifier();

    /**
     * @return the loaded signal
     * @throws com.phillippitts.scalogram.exception.LoadFailureException if the input cannot be read or parsed
     */
    Signal load();
}
