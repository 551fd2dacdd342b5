package com.ivamare.eventdispatch.model;

import java.util.concurrent.CancellationException;

/**
 * Advisory cancellation signal threaded through one dispatch call.
 *
 * <p>Handlers that declare it as their last parameter may observe it; the dispatcher
 * never aborts remaining handlers because of it.
 */
public final class CancellationToken {

    /** Token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    public static CancellationToken cancelled() {
        CancellationToken token = create();
        token.cancel();
        return token;
    }

    /**
     * Request cancellation. Has no effect on {@link #NONE}.
     */
    public void cancel() {
        if (cancellable) {
            cancelled = true;
        }
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public boolean canBeCancelled() {
        return cancellable;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancellationException("Cancellation requested");
        }
    }

    @Override
    public String toString() {
        return cancellable ? "CancellationToken[cancelled=" + cancelled + "]" : "CancellationToken.NONE";
    }
}
