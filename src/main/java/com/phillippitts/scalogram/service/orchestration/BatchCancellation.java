package com.phillippitts.scalogram.service.orchestration;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token for one batch run.
 *
 * <p>Inputs that have not started when the token is cancelled are reported as cancelled;
 * inputs already in progress run to completion.
 */
public final class BatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Requests cancellation. Idempotent.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
