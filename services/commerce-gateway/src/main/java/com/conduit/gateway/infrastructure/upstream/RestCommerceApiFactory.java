package com.conduit.gateway.infrastructure.upstream;

import com.conduit.client.CommerceApi;
import com.conduit.client.CommerceApiFactory;
import com.conduit.client.TenantCredentials;
import org.springframework.web.client.RestTemplate;

/** Builds one {@link RestCommerceApi} per tenant, all sharing the same {@link RestTemplate}. */
public class RestCommerceApiFactory implements CommerceApiFactory {

    private final RestTemplate restTemplate;
    private final String apiVersion;

    public RestCommerceApiFactory(RestTemplate restTemplate, String apiVersion) {
        this.restTemplate = restTemplate;
        this.apiVersion = apiVersion;
    }

    @Override
    public CommerceApi create(TenantCredentials credentials) {
        return new RestCommerceApi(restTemplate, apiVersion, credentials);
    }
}
