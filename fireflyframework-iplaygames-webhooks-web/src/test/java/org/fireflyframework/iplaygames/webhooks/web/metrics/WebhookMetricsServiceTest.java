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

package org.fireflyframework.iplaygames.webhooks.web.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebhookMetricsService Tests")
class WebhookMetricsServiceTest {

    private WebhookMetricsService metricsService;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new WebhookMetricsService(meterRegistry);
    }

    @Test
    @DisplayName("Should increment webhook received counter on multiple calls")
    void shouldIncrementWebhookReceivedCounter() {
        metricsService.recordWebhookReceived();
        metricsService.recordWebhookReceived();
        metricsService.recordWebhookReceived();

        Counter counter = meterRegistry.find("iplaygames.webhooks.received").counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should record rejections per reason")
    void shouldRecordRejectionsPerReason() {
        metricsService.recordWebhookRejected("INVALID_SIGNATURE");
        metricsService.recordWebhookRejected("INVALID_SIGNATURE");
        metricsService.recordWebhookRejected("MALFORMED_PAYLOAD");

        Counter invalidSignature = meterRegistry.find("iplaygames.webhooks.rejected")
                .tag("reason", "INVALID_SIGNATURE")
                .counter();
        Counter malformed = meterRegistry.find("iplaygames.webhooks.rejected")
                .tag("reason", "MALFORMED_PAYLOAD")
                .counter();

        assertThat(invalidSignature).isNotNull();
        assertThat(invalidSignature.count()).isEqualTo(2.0);
        assertThat(malformed).isNotNull();
        assertThat(malformed.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record processed webhooks and timing per type")
    void shouldRecordProcessedWebhooksPerType() {
        Instant startTime = Instant.now().minusMillis(25);

        metricsService.recordWebhookProcessed("bet", startTime);
        metricsService.recordWebhookProcessed("win", startTime);

        Counter bets = meterRegistry.find("iplaygames.webhooks.processed").tag("type", "bet").counter();
        Timer betTimer = meterRegistry.find("iplaygames.webhooks.processing.time").tag("type", "bet").timer();

        assertThat(bets).isNotNull();
        assertThat(bets.count()).isEqualTo(1.0);
        assertThat(betTimer).isNotNull();
        assertThat(betTimer.count()).isEqualTo(1);
        assertThat(meterRegistry.find("iplaygames.webhooks.processed").tag("type", "win").counter()).isNotNull();
    }
}
