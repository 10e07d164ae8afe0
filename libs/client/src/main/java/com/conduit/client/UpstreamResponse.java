package com.conduit.client;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Status, headers and body of one upstream attempt.
 * <p>
 * Header names are matched case-insensitively.
 *
 * @param status  HTTP status code
 * @param headers response headers (first value per name)
 * @param body    decoded body, nullable
 * @param <T>     body type
 */
public record UpstreamResponse<T>(int status, Map<String, String> headers, T body) {

    public UpstreamResponse {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
    }

    public static <T> UpstreamResponse<T> of(int status, T body) {
        return new UpstreamResponse<>(status, Map.of(), body);
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
