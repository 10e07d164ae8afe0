package com.conduit.client.retry;

/**
 * An upstream attempt that completed with a retryable HTTP status.
 */
public class UpstreamStatusException extends RuntimeException {

    private final int status;

    public UpstreamStatusException(int status, int attempt) {
        super("Upstream returned status %d on attempt %d".formatted(status, attempt));
        this.status = status;
    }

    public int status() {
        return status;
    }
}
