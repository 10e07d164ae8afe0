package com.conduit.client;

/**
 * A single attempt at an upstream call. Invoked once per attempt by the retry executor, so it
 * must be safe to repeat.
 *
 * @param <T> response body type
 */
@FunctionalInterface
public interface UpstreamCall<T> {

    UpstreamResponse<T> attempt();
}
