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

package org.fireflyframework.iplaygames.webhooks.core.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Normalized IPlayGames webhook.
 * <p>
 * One instance is built per inbound request by
 * {@link org.fireflyframework.iplaygames.webhooks.core.parser.WebhookPayloadParser} and is
 * immutable afterwards. String fields that are missing from the payload are empty strings;
 * numeric fields that are missing are {@code null}.
 * <p>
 * Monetary amounts are always in minor units (cents). {@link #getAmountInMajorUnits()} is the
 * only place where they are scaled.
 */
@Value
@Builder
public class WebhookEvent {

    /**
     * Raw value of the {@code type} field. Kept as a string so unknown types pass through.
     */
    @Builder.Default
    String type = "";

    @Builder.Default
    String playerId = "";

    /**
     * ISO-4217 currency code.
     */
    @Builder.Default
    String currency = "";

    /**
     * ISO-8601 timestamp, passed through verbatim.
     */
    @Builder.Default
    String timestamp = "";

    Long gameId;

    @Builder.Default
    String gameType = "";

    /**
     * Upstream transaction identifier, the idempotency key for financial events.
     */
    Long transactionId;

    /**
     * Amount in minor currency units. Zero is a present value, distinct from {@code null}.
     */
    Long amountMinorUnits;

    @Builder.Default
    String sessionId = "";

    @Builder.Default
    String roundId = "";

    @Builder.Default
    String rewardType = "";

    @Builder.Default
    String rewardTitle = "";

    boolean freespin;

    @Builder.Default
    String freespinId = "";

    Integer freespinTotal;

    Integer freespinsRemaining;

    Integer freespinRoundNumber;

    Double freespinTotalWinnings;

    /**
     * Every key of the original payload, for fields this class does not model.
     */
    @Builder.Default
    Map<String, Object> rawFields = Map.of();

    /**
     * Resolves the canonical type of this event.
     *
     * @return the canonical type, or empty when the sender used an unrecognized tag
     */
    public Optional<WebhookEventType> getEventType() {
        return WebhookEventType.fromValue(type);
    }

    public boolean isAuthenticate() {
        return is(WebhookEventType.AUTHENTICATE);
    }

    public boolean isBalanceCheck() {
        return is(WebhookEventType.BALANCE_CHECK);
    }

    public boolean isBet() {
        return is(WebhookEventType.BET);
    }

    public boolean isWin() {
        return is(WebhookEventType.WIN);
    }

    public boolean isRollback() {
        return is(WebhookEventType.ROLLBACK);
    }

    public boolean isReward() {
        return is(WebhookEventType.REWARD);
    }

    /**
     * Converts the amount to major currency units (amount / 100).
     *
     * @return the amount in major units, or empty if the payload carried no amount
     */
    public Optional<Double> getAmountInMajorUnits() {
        if (amountMinorUnits == null) {
            return Optional.empty();
        }
        return Optional.of(amountMinorUnits / 100.0);
    }

    /**
     * Builds the key a receiving wallet uses to detect duplicate deliveries.
     * <p>
     * The type is part of the key because a rollback carries the transaction id of the bet
     * it reverses.
     *
     * @return {@code type:transactionId}, or empty if the event has no transaction id
     */
    public Optional<String> getIdempotencyKey() {
        if (transactionId == null) {
            return Optional.empty();
        }
        return Optional.of(type + ":" + transactionId);
    }

    /**
     * Gets a value from the original payload.
     *
     * @param key the payload key
     * @return the raw value, or {@code null} if the key is absent
     */
    public Object get(String key) {
        return rawFields.get(key);
    }

    private boolean is(WebhookEventType eventType) {
        return eventType.getValue().equals(type);
    }
}
