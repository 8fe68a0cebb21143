package com.questrail.testkit.api;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * OperationContext
 * -----------------------------------------------------------------------------
 * Cancellation handle passed to every engine operation and to each handler
 * callback that may block.
 *
 * <p>A context is either {@linkplain #background() never cancelled} or
 * {@linkplain #cancellable() cancellable} from any thread. Cancellation is
 * cooperative: the engine checks the context between handler invocations,
 * and handlers that perform long-running work should do the same.</p>
 */
public final class OperationContext
{
    private static final OperationContext BACKGROUND = new OperationContext(false);

    private final boolean cancellable;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    private OperationContext(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Returns the shared context that is never cancelled.
     */
    public static OperationContext background() {
        return BACKGROUND;
    }

    /**
     * Returns a new context that can be cancelled with {@link #cancel()}.
     */
    public static OperationContext cancellable() {
        return new OperationContext(true);
    }

    /**
     * Cancels this context. Cancelling more than once has no further effect.
     *
     * @throws UnsupportedOperationException if this is the background context
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("the background context cannot be cancelled");
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * @throws CancellationException if this context has been cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("operation cancelled");
        }
    }

    /**
     * Blocks for up to {@code timeout}, returning early if the context is
     * cancelled.
     *
     * @return true if the context was cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (!cancellable) {
            Thread.sleep(timeout.toMillis());
            return false;
        }
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
