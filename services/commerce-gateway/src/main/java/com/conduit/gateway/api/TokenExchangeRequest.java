package com.conduit.gateway.api;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * @param code authorization code from the OAuth redirect
 * @param scopes scopes that were requested, recorded with the shop
 */
public record TokenExchangeRequest(@NotBlank String code, List<String> scopes) {}
