package com.codestyle.api;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal threaded through every analysis and fix operation.
 * Work polls the token at project and document granularity and stops on its own.
 */
public final class CancellationToken {
    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final boolean cancellable;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Requests cancellation. Has no effect on {@link #NONE}.
     */
    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new CancellationException("Operation was cancelled");
        }
    }
}
