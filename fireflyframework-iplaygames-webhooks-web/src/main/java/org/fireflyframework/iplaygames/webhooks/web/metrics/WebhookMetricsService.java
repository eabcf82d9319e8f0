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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for recording IPlayGames webhook metrics using Micrometer.
 * <p>
 * Event types are tagged with their canonical value or {@code unknown}, so a sender cannot
 * create unbounded tag values.
 */
@Service
@Slf4j
public class WebhookMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter receivedCounter;
    private final ConcurrentHashMap<String, Counter> rejectedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> processedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> processingTimers = new ConcurrentHashMap<>();

    public WebhookMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.receivedCounter = Counter.builder("iplaygames.webhooks.received")
                .description("Total number of webhooks received")
                .register(meterRegistry);
    }

    /**
     * Records a webhook received event.
     */
    public void recordWebhookReceived() {
        receivedCounter.increment();
    }

    /**
     * Records a webhook rejection (bad signature, malformed payload, request validation).
     *
     * @param reason the rejection reason
     */
    public void recordWebhookRejected(String reason) {
        getRejectedCounter(reason).increment();
        log.debug("Recorded webhook rejection, reason: {}", reason);
    }

    /**
     * Records a webhook that was verified and answered.
     *
     * @param eventType the canonical event type, or {@code unknown}
     * @param startTime when the request was received
     */
    public void recordWebhookProcessed(String eventType, Instant startTime) {
        Duration duration = Duration.between(startTime, Instant.now());
        getProcessedCounter(eventType).increment();
        getProcessingTimer(eventType).record(duration);
        log.debug("Recorded processed webhook: type={} - {}ms", eventType, duration.toMillis());
    }

    private Counter getRejectedCounter(String reason) {
        return rejectedCounters.computeIfAbsent(reason, r ->
                Counter.builder("iplaygames.webhooks.rejected")
                        .description("Total number of webhooks rejected")
                        .tag("reason", r)
                        .register(meterRegistry)
        );
    }

    private Counter getProcessedCounter(String eventType) {
        return processedCounters.computeIfAbsent(eventType, type ->
                Counter.builder("iplaygames.webhooks.processed")
                        .description("Total number of webhooks verified and answered")
                        .tag("type", type)
                        .register(meterRegistry)
        );
    }

    private Timer getProcessingTimer(String eventType) {
        return processingTimers.computeIfAbsent(eventType, type ->
                Timer.builder("iplaygames.webhooks.processing.time")
                        .description("Webhook processing time from receipt to reply")
                        .tag("type", type)
                        .register(meterRegistry)
        );
    }
}
