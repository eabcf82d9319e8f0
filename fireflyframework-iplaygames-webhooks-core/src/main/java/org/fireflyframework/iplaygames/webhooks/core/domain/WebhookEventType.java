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

import java.util.Optional;

/**
 * Canonical webhook types sent by IPlayGames.
 * <p>
 * The set is open on the wire: a payload carrying any other {@code type} still parses,
 * it just has no matching constant here.
 */
public enum WebhookEventType {

    /** Player session authentication */
    AUTHENTICATE("authenticate"),
    /** Balance inquiry */
    BALANCE_CHECK("balance_check"),
    /** Stake debited from the player */
    BET("bet"),
    /** Winnings credited to the player */
    WIN("win"),
    /** Reversal of an earlier bet */
    ROLLBACK("rollback"),
    /** Promotional reward */
    REWARD("reward");

    private final String value;

    WebhookEventType(String value) {
        this.value = value;
    }

    /**
     * Gets the wire value of this type.
     *
     * @return the value of the {@code type} field
     */
    public String getValue() {
        return value;
    }

    /**
     * Resolves a wire value to a canonical type.
     *
     * @param value the value of the {@code type} field
     * @return the matching type, or empty if the value is not one of the canonical tags
     */
    public static Optional<WebhookEventType> fromValue(String value) {
        for (WebhookEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
