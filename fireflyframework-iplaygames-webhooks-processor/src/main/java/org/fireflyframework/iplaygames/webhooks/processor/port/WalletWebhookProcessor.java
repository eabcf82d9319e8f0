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

package org.fireflyframework.iplaygames.webhooks.processor.port;

import org.fireflyframework.iplaygames.webhooks.core.domain.WebhookEvent;
import org.fireflyframework.iplaygames.webhooks.core.response.WebhookResponses;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Port implemented by the operator's wallet to act on verified IPlayGames webhooks.
 * <p>
 * Each method receives an authenticated, normalized event and returns the reply sent back
 * to IPlayGames, built with {@link WebhookResponses}. Types the wallet does not override
 * are answered with an {@code UNSUPPORTED_EVENT} error.
 * <p>
 * Financial events (bet, win, rollback, reward) must be applied at most once. Use
 * {@link WebhookEvent#getIdempotencyKey()} to detect redelivery and answer duplicates with
 * {@link WebhookResponses#alreadyProcessed(double)}.
 * <p>
 * <b>Example Implementation:</b>
 * <pre>
 * {@code
 * @Component
 * public class CasinoWalletProcessor implements WalletWebhookProcessor {
 *
 *     @Override
 *     public Mono<Map<String, Object>> bet(WebhookEvent event) {
 *         return wallet.debit(event.getPlayerId(), event.getAmountMinorUnits(), event.getIdempotencyKey())
 *                 .map(balance -> WebhookResponses.success(balance, null));
 *     }
 * }
 * }
 * </pre>
 */
public interface WalletWebhookProcessor {

    String UNSUPPORTED_EVENT = "UNSUPPORTED_EVENT";

    default Mono<Map<String, Object>> authenticate(WebhookEvent event) {
        return unsupported(event);
    }

    default Mono<Map<String, Object>> balanceCheck(WebhookEvent event) {
        return unsupported(event);
    }

    default Mono<Map<String, Object>> bet(WebhookEvent event) {
        return unsupported(event);
    }

    default Mono<Map<String, Object>> win(WebhookEvent event) {
        return unsupported(event);
    }

    default Mono<Map<String, Object>> rollback(WebhookEvent event) {
        return unsupported(event);
    }

    default Mono<Map<String, Object>> reward(WebhookEvent event) {
        return unsupported(event);
    }

    /**
     * Handles events whose type has no dedicated method, including types IPlayGames may add later.
     *
     * @param event the webhook event
     * @return the reply
     */
    default Mono<Map<String, Object>> unsupported(WebhookEvent event) {
        return Mono.just(WebhookResponses.error(UNSUPPORTED_EVENT, "Unsupported webhook type: " + event.getType()));
    }

    /**
     * Gets the processor type identifier for logging.
     * <p>
     * Default implementation returns the simple class name.
     *
     * @return the processor type
     */
    default String getProcessorType() {
        return this.getClass().getSimpleName();
    }

    /**
     * Hook called before the event is routed.
     *
     * @param event the webhook event
     * @return a Mono that completes when preprocessing is done
     */
    default Mono<Void> beforeProcess(WebhookEvent event) {
        return Mono.empty();
    }

    /**
     * Hook called after a reply has been produced.
     *
     * @param event the webhook event
     * @param response the reply
     * @return a Mono that completes when post-processing is done
     */
    default Mono<Void> afterProcess(WebhookEvent event, Map<String, Object> response) {
        return Mono.empty();
    }

    /**
     * Hook called when processing fails with an error.
     *
     * @param event the webhook event
     * @param error the error that occurred
     * @return a Mono that completes when error handling is done
     */
    default Mono<Void> onError(WebhookEvent event, Throwable error) {
        return Mono.empty();
    }
}
