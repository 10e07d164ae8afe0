package com.conduit.client.retry;

import java.util.OptionalInt;

/**
 * Thrown once every attempt allowed by the {@link RetryPolicy} failed transiently. The cause is
 * the last observed failure.
 */
public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;
    private final Integer lastStatus;

    public RetriesExhaustedException(int attempts, Integer lastStatus, Throwable lastFailure) {
        super("Max retries exceeded after %d attempts: %s".formatted(attempts, lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
        this.lastStatus = lastStatus;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Status of the last attempt, empty when it failed at the network level.
     */
    public OptionalInt lastStatus() {
        return lastStatus == null ? OptionalInt.empty() : OptionalInt.of(lastStatus);
    }
}
