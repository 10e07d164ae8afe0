package com.conduit.client;

/**
 * Builds the {@link CommerceApi} for a tenant's credentials. Called by the pool at most once per
 * cached client; any runtime exception is reported as a {@link ClientConstructionException}.
 */
@FunctionalInterface
public interface CommerceApiFactory {

    CommerceApi create(TenantCredentials credentials);
}
