package com.conduit.client;

/**
 * Identifies one tenant: a project in one environment.
 * <p>
 * Equality is by both components; the record itself keys the client cache and every tenant
 * store. {@link #value()} ({@code "<projectId>-<environment>"}) is a label for logs and
 * responses and is not unique: {@code acme-prod/main} and {@code acme/prod-main} print alike.
 * A blank environment falls back to {@value #DEFAULT_ENVIRONMENT}.
 *
 * @param projectId   platform project identifier
 * @param environment deployment environment of the project
 */
public record TenantKey(String projectId, String environment) {

    /** Environment used when a caller does not name one. */
    public static final String DEFAULT_ENVIRONMENT = "master";

    public TenantKey {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be null or blank");
        }
        if (environment == null || environment.isBlank()) {
            environment = DEFAULT_ENVIRONMENT;
        }
    }

    /**
     * Creates a key, defaulting the environment when blank.
     */
    public static TenantKey of(String projectId, String environment) {
        return new TenantKey(projectId, environment);
    }

    /**
     * Returns the display label {@code projectId-environment}. Never look a tenant up by it.
     */
    public String value() {
        return projectId + "-" + environment;
    }

    @Override
    public String toString() {
        return value();
    }
}
