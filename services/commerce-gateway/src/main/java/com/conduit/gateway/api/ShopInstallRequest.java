package com.conduit.gateway.api;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Registers a shop with an access token obtained outside the gateway.
 *
 * @param accessToken shop access token
 * @param scopes granted scopes, optional
 */
public record ShopInstallRequest(@NotBlank String accessToken, List<String> scopes) {

    @Override
    public String toString() {
        return "ShopInstallRequest[accessToken=***, scopes=" + scopes + "]";
    }
}
