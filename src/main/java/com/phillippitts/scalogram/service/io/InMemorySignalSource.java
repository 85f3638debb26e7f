package com.phillippitts.scalogram.service.io;

import com.phillippitts.scalogram.domain.Signal;

import java.util.Objects;

/**
 * Source wrapping an already loaded signal.
 */
public final class InMemorySignalSource implements SignalSource {

    private final Signal signal;

    public InMemorySignalSource(Signal signal) {
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
    }

    public InMemorySignalSource(String identifier, double[] samples, double sampleRate) {
        this(new Signal(identifier, samples, sampleRate));
    }

    @Override
    public String identifier() {
        return signal.identifier();
    }

    @Override
    public Signal load() {
        return signal;
    }
}
