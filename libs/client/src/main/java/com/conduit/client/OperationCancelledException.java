package com.conduit.client;

/**
 * Thrown when a blocking operation is abandoned because its {@link CancellationToken} fired or
 * its deadline passed. Never retried.
 */
public class OperationCancelledException extends RuntimeException {

    private final boolean deadlineExceeded;

    public OperationCancelledException(String message, boolean deadlineExceeded) {
        super(message);
        this.deadlineExceeded = deadlineExceeded;
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
        this.deadlineExceeded = false;
    }

    /**
     * {@code true} when the operation ran out of time rather than being cancelled by a caller.
     */
    public boolean deadlineExceeded() {
        return deadlineExceeded;
    }
}
