package com.conduit.gateway;

import com.conduit.gateway.config.ConduitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Commerce Gateway: the single entry point between the platform and the upstream commerce API.
 *
 * <p>Responsibilities:
 *
 * <ul>
 *   <li>Webhook intake: signature check against the tenant's secret, then topic fan-out
 *   <li>Tenant credential and shop token administration (secrets encrypted at rest)
 *   <li>Upstream proxy through the tenant's pooled, rate-limited, retrying client
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(ConduitProperties.class)
public class CommerceGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(CommerceGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CommerceGatewayApplication.class, args);
        log.info("Commerce Gateway started");
    }
}
