package com.conduit.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.conduit.client.CommerceApi;
import com.conduit.client.CommerceApiFactory;
import com.conduit.client.UpstreamRequest;
import com.conduit.client.UpstreamResponse;
import com.conduit.client.ratelimit.RateLimiter;
import com.conduit.gateway.api.WebhookController;
import com.conduit.gateway.config.ConduitProperties;
import com.conduit.security.WebhookSignatureVerifier;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * End-to-end tests of the gateway over MockMvc. The upstream is replaced by a mocked
 * {@link CommerceApiFactory}; everything else is the production wiring. Each test uses its own
 * project id because the in-memory stores live as long as the cached context.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Commerce Gateway Application")
class CommerceGatewayApplicationTest {

    private static final String SHOP = "acme.myshopify.com";
    private static final String SECRET = "app-secret-value";
    private static final String INSTALL_SHOP = "install-it.myshopify.com";

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @MockBean private CommerceApiFactory apiFactory;

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier();
    private final CommerceApi api = mock(CommerceApi.class);

    @BeforeEach
    void setUp() {
        when(apiFactory.create(any())).thenReturn(api);
    }

    private void saveCredentials(String projectId, String body) throws Exception {
        mockMvc.perform(put("/api/v1/tenants/{p}/master/credentials", projectId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());
    }

    private void saveCredentials(String projectId) throws Exception {
        saveCredentials(projectId, "{\"apiKey\":\"key\",\"apiSecret\":\"" + SECRET + "\"}");
    }

    private void installShop(String projectId) throws Exception {
        mockMvc.perform(put("/api/v1/tenants/{p}/master/shops/{shop}", projectId, SHOP)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accessToken\":\"shpat_token\",\"scopes\":[\"read_products\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shopDomain").value(SHOP))
                .andExpect(content().string(not(containsString("shpat_token"))));
    }

    @Nested
    @DisplayName("platform")
    class Platform {

        @Test
        @DisplayName("loads properties from the test profile")
        void propertiesLoaded() {
            var props = context.getBean(ConduitProperties.class);
            assertThat(props.serviceName()).isEqualTo("commerce-gateway-test");
            assertThat(props.retry().maxRetries()).isEqualTo(2);
        }

        @Test
        @DisplayName("info endpoint reports the service")
        void infoEndpoint() throws Exception {
            mockMvc.perform(get("/api/v1/info"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("commerce-gateway-test"))
                    .andExpect(jsonPath("$.status").value("running"));
        }

        @Test
        @DisplayName("actuator health is available")
        void health() throws Exception {
            mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
        }

        @Test
        @DisplayName("every response carries correlation and security headers")
        void responseHeaders() throws Exception {
            mockMvc.perform(get("/api/v1/info").header("X-Correlation-ID", "it-corr-1"))
                    .andExpect(header().string("X-Correlation-ID", "it-corr-1"))
                    .andExpect(header().string("X-Content-Type-Options", "nosniff"))
                    .andExpect(header().string("X-Frame-Options", "DENY"));
        }
    }

    @Nested
    @DisplayName("credentials")
    class Credentials {

        @Test
        @DisplayName("status never exposes secrets")
        void statusHidesSecrets() throws Exception {
            saveCredentials("it-creds", "{\"apiKey\":\"key\",\"apiSecret\":\"" + SECRET + "\",\"webhookSecret\":\"hook\"}");

            mockMvc.perform(get("/api/v1/tenants/it-creds/master/credentials"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.configured").value(true))
                    .andExpect(jsonPath("$.hasWebhookSecret").value(true))
                    .andExpect(content().string(not(containsString(SECRET))));
        }

        @Test
        @DisplayName("an unknown tenant reports configured=false")
        void unknownTenant() throws Exception {
            mockMvc.perform(get("/api/v1/tenants/it-nobody/master/credentials"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.configured").value(false));
        }

        @Test
        @DisplayName("rejects a request without a secret")
        void validation() throws Exception {
            mockMvc.perform(put("/api/v1/tenants/it-invalid/master/credentials")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"apiKey\":\"key\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Validation Error"));
        }

        @Test
        @DisplayName("delete returns 204, then 404")
        void delete204Then404() throws Exception {
            saveCredentials("it-delete");

            mockMvc.perform(delete("/api/v1/tenants/it-delete/master/credentials")).andExpect(status().isNoContent());
            mockMvc.perform(delete("/api/v1/tenants/it-delete/master/credentials")).andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("rejects malformed project ids")
        void badProjectId() throws Exception {
            mockMvc.perform(get("/api/v1/tenants/bad$id/master/credentials"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.correlationId").exists());
        }
    }

    @Nested
    @DisplayName("webhooks")
    class Webhooks {

        private final byte[] body = "{\"id\":1001,\"financial_status\":\"paid\"}".getBytes(StandardCharsets.UTF_8);

        @Test
        @DisplayName("a signed delivery is dispatched to the matching handler")
        void signedDelivery() throws Exception {
            saveCredentials("it-hook");

            mockMvc.perform(post("/webhooks/it-hook/master")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body)
                            .header(WebhookController.SIGNATURE_HEADER, verifier.sign(body, SECRET))
                            .header(WebhookController.TOPIC_HEADER, "orders/create")
                            .header(WebhookController.SHOP_DOMAIN_HEADER, SHOP))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.received").value(true))
                    .andExpect(jsonPath("$.handlers").value(1));
        }

        @Test
        @DisplayName("the environment defaults when the path omits it")
        void defaultEnvironment() throws Exception {
            saveCredentials("it-hook-default");

            mockMvc.perform(post("/webhooks/it-hook-default")
                            .content(body)
                            .header(WebhookController.SIGNATURE_HEADER, verifier.sign(body, SECRET))
                            .header(WebhookController.TOPIC_HEADER, "carts/update"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.handlers").value(0));
        }

        @Test
        @DisplayName("a missing signature is a 400")
        void missingSignature() throws Exception {
            saveCredentials("it-hook-nosig");

            mockMvc.perform(post("/webhooks/it-hook-nosig/master")
                            .content(body)
                            .header(WebhookController.TOPIC_HEADER, "orders/create"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("a missing topic is a 400")
        void missingTopic() throws Exception {
            saveCredentials("it-hook-notopic");

            mockMvc.perform(post("/webhooks/it-hook-notopic/master")
                            .content(body)
                            .header(WebhookController.SIGNATURE_HEADER, verifier.sign(body, SECRET)))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("a wrong signature is a 401")
        void wrongSignature() throws Exception {
            saveCredentials("it-hook-bad");

            mockMvc.perform(post("/webhooks/it-hook-bad/master")
                            .content(body)
                            .header(WebhookController.SIGNATURE_HEADER, verifier.sign(body, "other-secret"))
                            .header(WebhookController.TOPIC_HEADER, "orders/create"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.type").value("https://conduit.dev/errors/invalid-signature"));
        }

        @Test
        @DisplayName("an unknown tenant is a 404")
        void unknownTenant() throws Exception {
            mockMvc.perform(post("/webhooks/it-hook-unknown/master")
                            .content(body)
                            .header(WebhookController.SIGNATURE_HEADER, verifier.sign(body, SECRET))
                            .header(WebhookController.TOPIC_HEADER, "orders/create"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("app/uninstalled removes the shop's token")
        void appUninstalled() throws Exception {
            saveCredentials("it-uninstall");
            installShop("it-uninstall");
            byte[] payload = "{\"id\":1,\"myshopify_domain\":\"acme.myshopify.com\"}".getBytes(StandardCharsets.UTF_8);

            mockMvc.perform(post("/webhooks/it-uninstall/master")
                            .content(payload)
                            .header(WebhookController.SIGNATURE_HEADER, verifier.sign(payload, SECRET))
                            .header(WebhookController.TOPIC_HEADER, "app/uninstalled")
                            .header(WebhookController.SHOP_DOMAIN_HEADER, SHOP))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.handlers").value(1));

            mockMvc.perform(get("/api/v1/tenants/it-uninstall/master/shops/{shop}", SHOP))
                    .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("upstream proxy")
    class Proxy {

        @Test
        @DisplayName("wraps JSON answers and passes the call-limit header on")
        void forwardsAndWraps() throws Exception {
            saveCredentials("it-proxy");
            installShop("it-proxy");
            when(api.send(any())).thenReturn(new UpstreamResponse<>(200,
                    Map.of(RateLimiter.CALL_LIMIT_HEADER, "5/40"), "{\"products\":[{\"id\":7}]}"));

            mockMvc.perform(get("/api/v1/tenants/it-proxy/master/shops/{shop}/admin/products.json", SHOP)
                            .queryParam("limit", "5"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.products[0].id").value(7))
                    .andExpect(jsonPath("$.meta.path").value("products.json"))
                    .andExpect(header().string(RateLimiter.CALL_LIMIT_HEADER, "5/40"));

            ArgumentCaptor<UpstreamRequest> sent = ArgumentCaptor.forClass(UpstreamRequest.class);
            verify(api).send(sent.capture());
            assertThat(sent.getValue().accessToken()).isEqualTo("shpat_token");
            assertThat(sent.getValue().query()).isEqualTo("limit=5");
        }

        @Test
        @DisplayName("passes upstream client errors through with their status")
        void passesClientErrors() throws Exception {
            saveCredentials("it-proxy-404");
            installShop("it-proxy-404");
            when(api.send(any())).thenReturn(UpstreamResponse.of(404, "{\"errors\":\"Not Found\"}"));

            mockMvc.perform(get("/api/v1/tenants/it-proxy-404/master/shops/{shop}/admin/products/9.json", SHOP))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.data.errors").value("Not Found"));
        }

        @Test
        @DisplayName("exhausted retries become a 502")
        void exhaustedRetries() throws Exception {
            saveCredentials("it-proxy-503");
            installShop("it-proxy-503");
            when(api.send(any())).thenReturn(UpstreamResponse.of(503, "unavailable"));

            mockMvc.perform(get("/api/v1/tenants/it-proxy-503/master/shops/{shop}/admin/orders.json", SHOP))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.upstreamStatus").value(503));

            verify(api, times(3)).send(any());
        }

        @Test
        @DisplayName("a shop that is not installed is a 404")
        void unknownShop() throws Exception {
            saveCredentials("it-proxy-noshop");

            mockMvc.perform(get("/api/v1/tenants/it-proxy-noshop/master/shops/{shop}/admin/orders.json", SHOP))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.title").value("Shop Not Found"));
        }

        @Test
        @DisplayName("a malformed shop domain is a 400")
        void badShop() throws Exception {
            mockMvc.perform(get("/api/v1/tenants/it-proxy-bad/master/shops/not_a_shop/admin/orders.json"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("OAuth install")
    class Install {

        @Test
        @DisplayName("a completed install stores the token and subscribes the default webhook topics")
        void completesInstallAndSubscribes() throws Exception {
            saveCredentials("it-install");
            when(api.exchangeToken(INSTALL_SHOP, "code-1")).thenReturn("shpat_installed");
            when(api.send(any())).thenReturn(UpstreamResponse.of(201, "{\"webhook\":{\"id\":1}}"));

            mockMvc.perform(post("/api/v1/tenants/it-install/master/shops/{shop}/oauth/token", INSTALL_SHOP)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"code\":\"code-1\",\"scopes\":[\"read_orders\"]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.shopDomain").value(INSTALL_SHOP))
                    .andExpect(jsonPath("$.subscribedTopics.length()").value(5))
                    .andExpect(jsonPath("$.subscribedTopics[0]").value("orders/create"))
                    .andExpect(jsonPath("$.failedTopics").isEmpty())
                    .andExpect(content().string(not(containsString("shpat_installed"))));

            ArgumentCaptor<UpstreamRequest> sent = ArgumentCaptor.forClass(UpstreamRequest.class);
            verify(api, times(5)).send(sent.capture());
            assertThat(sent.getAllValues()).allSatisfy(request -> {
                assertThat(request.path()).isEqualTo("webhooks.json");
                assertThat(request.accessToken()).isEqualTo("shpat_installed");
                assertThat(request.body()).contains("https://gateway.test/webhooks/it-install/master");
            });

            mockMvc.perform(get("/api/v1/tenants/it-install/master/shops/{shop}", INSTALL_SHOP))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.subscribedTopics").doesNotExist());
        }

        @Test
        @DisplayName("subscriptions can be registered again for an installed shop")
        void resubscribes() throws Exception {
            saveCredentials("it-resubscribe");
            installShop("it-resubscribe");
            when(api.send(any())).thenReturn(
                    UpstreamResponse.of(422, "{\"errors\":{\"address\":[\"for this topic has already been taken\"]}}"));

            mockMvc.perform(post("/api/v1/tenants/it-resubscribe/master/shops/{shop}/webhooks", SHOP))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.subscribed.length()").value(5))
                    .andExpect(jsonPath("$.failed").isEmpty());
        }

        @Test
        @DisplayName("registering subscriptions for a shop that is not installed is a 404")
        void resubscribeUnknownShop() throws Exception {
            saveCredentials("it-resubscribe-noshop");

            mockMvc.perform(post("/api/v1/tenants/it-resubscribe-noshop/master/shops/{shop}/webhooks", SHOP))
                    .andExpect(status().isNotFound());
        }
    }
}
