package com.conduit.client;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation signal with an optional deadline, passed to every blocking call of the rate
 * limiter and the retry executor.
 * <p>
 * {@link #sleep(Duration)} races the requested wait against {@link #cancel()} and the deadline
 * and returns control as soon as either fires. Thread interruption counts as cancellation; the
 * interrupt flag is restored before the exception is thrown.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(0L, false, false);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final long deadlineNanos;
    private final boolean hasDeadline;
    private final boolean cancellable;

    private CancellationToken(long deadlineNanos, boolean hasDeadline, boolean cancellable) {
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
        this.cancellable = cancellable;
    }

    /**
     * The shared token that never fires; {@link #cancel()} on it is ignored and waits run to
     * completion.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * A token without deadline that the creator may {@link #cancel()}.
     */
    public static CancellationToken create() {
        return new CancellationToken(0L, false, true);
    }

    /**
     * A token that expires {@code timeout} from now.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be null or negative");
        }
        return new CancellationToken(System.nanoTime() + timeout.toNanos(), true, true);
    }

    /**
     * Fires the token. No effect on {@link #none()}.
     */
    public void cancel() {
        if (cancellable) {
            cancelled.countDown();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || isDeadlineExceeded();
    }

    public boolean isDeadlineExceeded() {
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Time left until the deadline, empty when the token has none.
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime())));
    }

    /**
     * @throws OperationCancelledException if the token is cancelled or past its deadline
     */
    public void throwIfCancelled() {
        if (cancelled.getCount() == 0) {
            throw new OperationCancelledException("operation cancelled", false);
        }
        if (isDeadlineExceeded()) {
            throw new OperationCancelledException("deadline exceeded", true);
        }
    }

    /**
     * Blocks for {@code duration} unless cancelled first.
     *
     * @throws OperationCancelledException on cancellation, deadline or interrupt
     */
    public void sleep(Duration duration) {
        throwIfCancelled();
        long waitNanos = Math.max(0L, duration.toNanos());
        boolean cutByDeadline = false;
        if (hasDeadline) {
            long left = deadlineNanos - System.nanoTime();
            if (left < waitNanos) {
                waitNanos = Math.max(0L, left);
                cutByDeadline = true;
            }
        }
        try {
            if (cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
                throw new OperationCancelledException("operation cancelled", false);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("interrupted while waiting", e);
        }
        if (cutByDeadline) {
            throw new OperationCancelledException("deadline exceeded", true);
        }
    }
}
