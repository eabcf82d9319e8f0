/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.iplaygames.webhooks.web.integration;

import org.fireflyframework.iplaygames.webhooks.core.WebhookHandler;
import org.fireflyframework.iplaygames.webhooks.core.config.IPlayGamesWebhookProperties;
import org.fireflyframework.iplaygames.webhooks.web.integration.support.InMemoryWalletProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the endpoint with the shipped payload limit (1 MiB) to check that bodies above the
 * WebFlux codec default of 256 KiB are still accepted.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "iplaygames.webhooks.secret=" + WebhookDefaultLimitsIntegrationTest.SECRET
)
@Import(WebhookIntegrationTestConfiguration.class)
@AutoConfigureWebTestClient
@DisplayName("IPlayGames Webhook Default Limits Integration Tests")
class WebhookDefaultLimitsIntegrationTest {

    static final String SECRET = "whsec_default_limits_secret";
    private static final String ENDPOINT = "/api/v1/webhooks/iplaygames";
    private static final String PLAYER = "player_456";

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private WebhookHandler webhookHandler;

    @Autowired
    private IPlayGamesWebhookProperties properties;

    @Autowired
    private InMemoryWalletProcessor wallet;

    @BeforeEach
    void setUp() {
        wallet.reset();
        wallet.openAccount(PLAYER, 10_000L);
    }

    @Test
    @DisplayName("Should use a 1 MiB payload limit by default")
    void shouldUseDefaultPayloadLimit() {
        assertThat(properties.getMaxPayloadSize()).isEqualTo(1_048_576L);
    }

    @Test
    @DisplayName("Should expose only the actuator endpoints backed by a dependency")
    void shouldExposeConfiguredActuatorEndpoints() {
        webTestClient.get().uri("/actuator/health").exchange().expectStatus().isOk();
        webTestClient.get().uri("/actuator/metrics").exchange().expectStatus().isOk();
        webTestClient.get().uri("/actuator/prometheus").exchange().expectStatus().isNotFound();
    }

    @Test
    @DisplayName("Should answer a signed body larger than 256 KiB")
    void shouldAnswerBodyLargerThanCodecDefault() {
        byte[] payload = ("{\"type\":\"balance_check\",\"player_id\":\"player_456\",\"currency\":\"USD\","
                + "\"padding\":\"" + "x".repeat(300 * 1024) + "\"}").getBytes(StandardCharsets.UTF_8);

        webTestClient.post()
                .uri(ENDPOINT)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Signature", webhookHandler.sign(payload))
                .bodyValue(payload)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("success")
                .jsonPath("$.balance").isEqualTo(10000);
    }
}
