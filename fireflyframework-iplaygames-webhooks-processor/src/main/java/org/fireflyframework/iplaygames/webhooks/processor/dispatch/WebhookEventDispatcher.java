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

package org.fireflyframework.iplaygames.webhooks.processor.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iplaygames.webhooks.core.domain.WebhookEvent;
import org.fireflyframework.iplaygames.webhooks.core.domain.WebhookEventType;
import org.fireflyframework.iplaygames.webhooks.core.response.WebhookResponses;
import org.fireflyframework.iplaygames.webhooks.processor.port.WalletWebhookProcessor;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Routes verified webhook events to the matching {@link WalletWebhookProcessor} method.
 * <p>
 * The dispatcher always produces a reply: when the processor fails, the error is passed to
 * {@link WalletWebhookProcessor#onError} and IPlayGames receives an {@code INTERNAL_ERROR} reply.
 */
@Slf4j
public class WebhookEventDispatcher {

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final WalletWebhookProcessor processor;

    public WebhookEventDispatcher(WalletWebhookProcessor processor) {
        this.processor = processor;
        log.info("Initialized {} with processor: {}", getClass().getSimpleName(), processor.getProcessorType());
    }

    /**
     * Dispatches an event to the processor.
     *
     * @param event the verified webhook event
     * @return a Mono emitting the reply for IPlayGames
     */
    public Mono<Map<String, Object>> dispatch(WebhookEvent event) {
        Instant startTime = Instant.now();
        log.debug("Dispatching webhook: type={}, playerId={}, transactionId={}",
                event.getType(), event.getPlayerId(), event.getTransactionId());

        return Mono.defer(() -> processor.beforeProcess(event))
                .then(Mono.defer(() -> route(event)))
                .flatMap(response -> processor.afterProcess(event, response).thenReturn(response))
                .doOnSuccess(response -> log.info("Webhook processed: type={}, status={}, transactionId={}, duration={}ms",
                        event.getType(),
                        response != null ? response.get(WebhookResponses.STATUS) : null,
                        event.getTransactionId(),
                        Duration.between(startTime, Instant.now()).toMillis()))
                .onErrorResume(error -> {
                    log.error("Failed to process webhook: type={}, playerId={}, transactionId={}, error={}",
                            event.getType(), event.getPlayerId(), event.getTransactionId(), error.getMessage(), error);
                    return processor.onError(event, error)
                            .onErrorResume(hookError -> {
                                log.warn("onError hook failed for {}: {}", processor.getProcessorType(), hookError.getMessage());
                                return Mono.empty();
                            })
                            .thenReturn(WebhookResponses.error(INTERNAL_ERROR, "Internal error"));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.error("Processor {} returned no reply for webhook type={}", processor.getProcessorType(), event.getType());
                    return WebhookResponses.error(INTERNAL_ERROR, "Internal error");
                }));
    }

    private Mono<Map<String, Object>> route(WebhookEvent event) {
        WebhookEventType type = event.getEventType().orElse(null);
        if (type == null) {
            log.warn("Received webhook with unrecognized type: {}", event.getType());
            return processor.unsupported(event);
        }

        return switch (type) {
            case AUTHENTICATE -> processor.authenticate(event);
            case BALANCE_CHECK -> processor.balanceCheck(event);
            case BET -> processor.bet(event);
            case WIN -> processor.win(event);
            case ROLLBACK -> processor.rollback(event);
            case REWARD -> processor.reward(event);
        };
    }
}
