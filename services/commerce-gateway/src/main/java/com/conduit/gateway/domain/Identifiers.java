package com.conduit.gateway.domain;

import com.conduit.client.TenantKey;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation of identifiers that arrive in request paths and headers.
 *
 * <p>Shop domains are either {@code <name>.myshopify.com} with a 3-40 character name of lowercase
 * letters, digits and hyphens, or a plain custom domain. Project ids and environments are 1-64
 * characters of letters, digits, underscores and hyphens.
 */
public final class Identifiers {

    private static final String MYSHOPIFY_SUFFIX = ".myshopify.com";
    private static final Pattern SHOP_NAME = Pattern.compile("^[a-z0-9-]{3,40}$");
    private static final Pattern CUSTOM_DOMAIN =
            Pattern.compile("^(?=.{4,253}$)([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,}$");
    private static final Pattern PROJECT_ID = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    private Identifiers() {
        // utility class
    }

    public static boolean isValidShopDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return false;
        }
        if (domain.endsWith(MYSHOPIFY_SUFFIX)) {
            String name = domain.substring(0, domain.length() - MYSHOPIFY_SUFFIX.length());
            return SHOP_NAME.matcher(name).matches();
        }
        return CUSTOM_DOMAIN.matcher(domain.toLowerCase(Locale.ROOT)).matches();
    }

    public static boolean isValidProjectId(String projectId) {
        return projectId != null && PROJECT_ID.matcher(projectId).matches();
    }

    /**
     * Returns the shop domain unchanged.
     *
     * @throws IllegalArgumentException if the domain is malformed
     */
    public static String requireShopDomain(String domain) {
        if (!isValidShopDomain(domain)) {
            throw new IllegalArgumentException("Invalid shop domain format: '%s'".formatted(domain));
        }
        return domain;
    }

    /**
     * Builds a tenant key from path values, defaulting a missing environment.
     *
     * @throws IllegalArgumentException if the project id or environment is malformed
     */
    public static TenantKey tenantKey(String projectId, String environment, String defaultEnvironment) {
        if (!isValidProjectId(projectId)) {
            throw new IllegalArgumentException("Invalid project ID format: '%s'".formatted(projectId));
        }
        String env = environment == null || environment.isBlank() ? defaultEnvironment : environment;
        if (!isValidProjectId(env)) {
            throw new IllegalArgumentException("Invalid environment format: '%s'".formatted(env));
        }
        return TenantKey.of(projectId, env);
    }
}
