package com.dataset.matching.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-controlled signal that stops a batch early. Items that have not started when the
 * token is cancelled are reported as cancelled; items already running complete normally.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
