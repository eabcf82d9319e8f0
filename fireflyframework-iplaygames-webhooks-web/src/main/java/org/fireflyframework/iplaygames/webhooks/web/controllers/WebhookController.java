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

package org.fireflyframework.iplaygames.webhooks.web.controllers;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iplaygames.webhooks.core.WebhookHandler;
import org.fireflyframework.iplaygames.webhooks.core.domain.WebhookEvent;
import org.fireflyframework.iplaygames.webhooks.core.domain.WebhookEventType;
import org.fireflyframework.iplaygames.webhooks.processor.dispatch.WebhookEventDispatcher;
import org.fireflyframework.iplaygames.webhooks.web.metrics.WebhookMetricsService;
import org.fireflyframework.iplaygames.webhooks.web.validation.WebhookRequestValidator;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller receiving wallet webhooks from IPlayGames.
 * <p>
 * The body is taken as raw bytes because the signature covers the exact bytes sent.
 * Signature verification always happens before the body is parsed.
 * <p>
 * Every verified webhook is answered with {@code 200 OK} and a reply map; business outcomes
 * such as insufficient funds are expressed in the reply, not in the HTTP status. Rejected
 * requests are mapped to HTTP statuses by {@code WebhookExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "IPlayGames Webhooks", description = "Wallet callbacks sent by IPlayGames")
public class WebhookController {

    private final WebhookHandler webhookHandler;
    private final WebhookEventDispatcher dispatcher;
    private final WebhookRequestValidator requestValidator;
    private final WebhookMetricsService metricsService;

    /**
     * Receives a signed IPlayGames webhook.
     *
     * @param body the raw request body
     * @param request the HTTP request for extracting headers
     * @return a Mono containing the reply for IPlayGames
     */
    @PostMapping(
            value = "/iplaygames",
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
            summary = "Receive IPlayGames webhook",
            description = "Verifies the HMAC SHA256 signature of the raw body, normalizes the payload " +
                    "and dispatches it to the wallet by webhook type."
    )
    @ApiResponse(responseCode = "200", description = "Webhook verified and answered")
    @ApiResponse(responseCode = "400", description = "Malformed payload")
    @ApiResponse(responseCode = "401", description = "Missing or invalid signature")
    @ApiResponse(responseCode = "413", description = "Payload too large")
    @ApiResponse(responseCode = "415", description = "Unsupported Content-Type")
    public Mono<ResponseEntity<Map<String, Object>>> receiveWebhook(
            @Parameter(description = "Raw webhook payload")
            @RequestBody(required = false) byte[] body,
            ServerHttpRequest request
    ) {
        Instant startTime = Instant.now();
        String requestId = UUID.randomUUID().toString();

        // Set MDC for structured logging
        MDC.put("requestId", requestId);

        metricsService.recordWebhookReceived();

        return Mono.defer(() -> {
                    byte[] payload = body != null ? body : new byte[0];

                    requestValidator.validateRequest(payload, request);
                    String signature = requestValidator.extractSignature(request);

                    WebhookEvent event = webhookHandler.verifyAndParse(payload, signature);
                    MDC.put("eventType", event.getType());
                    log.info("Received webhook: type={}, playerId={}, transactionId={}",
                            event.getType(), event.getPlayerId(), event.getTransactionId());

                    String metricType = event.getEventType()
                            .map(WebhookEventType::getValue)
                            .orElse("unknown");

                    return dispatcher.dispatch(event)
                            .doOnNext(response -> metricsService.recordWebhookProcessed(metricType, startTime));
                })
                .map(ResponseEntity::ok)
                .doFinally(signal -> {
                    MDC.remove("requestId");
                    MDC.remove("eventType");
                });
    }
}
