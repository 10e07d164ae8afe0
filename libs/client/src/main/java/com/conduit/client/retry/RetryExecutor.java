package com.conduit.client.retry;

import com.conduit.client.CancellationToken;
import com.conduit.client.OperationCancelledException;
import com.conduit.client.UpstreamCall;
import com.conduit.client.UpstreamResponse;
import com.conduit.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Retries an upstream call with exponential backoff.
 * <p>
 * A response with a status outside the policy's retryable set is returned at once, whether it is
 * a success or not. Retryable statuses and transient network failures (timeouts and refused
 * connections, anywhere in the cause chain) are retried. Any other exception propagates on the
 * first attempt. Waits go through the caller's {@link CancellationToken}, so cancellation aborts
 * a backoff immediately; cancellation is never retried.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);
    private static final int MAX_CAUSE_DEPTH = 16;

    private final Counter retries;
    private final Counter exhausted;

    public RetryExecutor(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.retries = metrics.counter("conduit.upstream.retries", "Upstream attempts that were retried");
        this.exhausted = metrics.counter("conduit.upstream.retries.exhausted", "Calls that used up every retry");
    }

    /**
     * Runs {@code call} until it yields a non-retryable response or the policy is used up.
     *
     * @throws RetriesExhaustedException   if every attempt failed transiently
     * @throws OperationCancelledException if the token fires before or between attempts
     */
    public <T> UpstreamResponse<T> execute(UpstreamCall<T> call, RetryPolicy policy, CancellationToken cancellation) {
        Duration delay = policy.initialDelay();
        RuntimeException lastFailure = null;
        Integer lastStatus = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                log.warn("Retrying upstream call, attempt {} of {} after {} ms: {}",
                        attempt, policy.maxAttempts(), delay.toMillis(), lastFailure.getMessage());
                retries.increment();
                cancellation.sleep(delay);
                delay = policy.nextDelay(delay);
            }
            cancellation.throwIfCancelled();

            UpstreamResponse<T> response;
            try {
                response = call.attempt();
            } catch (OperationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!isTransient(e)) {
                    throw e;
                }
                lastFailure = e;
                lastStatus = null;
                continue;
            }

            if (!policy.isRetryableStatus(response.status())) {
                return response;
            }
            lastStatus = response.status();
            lastFailure = new UpstreamStatusException(response.status(), attempt);
        }

        exhausted.increment();
        log.error("All {} upstream attempts failed, last failure: {}", policy.maxAttempts(), lastFailure.getMessage());
        throw new RetriesExhaustedException(policy.maxAttempts(), lastStatus, lastFailure);
    }

    /**
     * Whether a failure is a network-level transient: a timeout or a refused connection somewhere
     * in its cause chain.
     */
    public static boolean isTransient(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof OperationCancelledException) {
                return false;
            }
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException
                    || current instanceof ConnectException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
