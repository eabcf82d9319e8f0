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

package org.fireflyframework.iplaygames.webhooks.core.response;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical replies an operator returns to an IPlayGames webhook.
 * <p>
 * Callers pass balances in major units; every balance on the wire is an integer count of
 * minor units. The conversion truncates toward zero on the decimal form of the value, so
 * {@code 0.29} becomes {@code 29} rather than the {@code 28} a plain {@code (long) (0.29 * 100)}
 * would give.
 */
public final class WebhookResponses {

    public static final String STATUS = "status";
    public static final String BALANCE = "balance";
    public static final String ERROR_CODE = "error_code";
    public static final String ERROR_MESSAGE = "error_message";
    public static final String ALREADY_PROCESSED = "already_processed";

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    public static final String PLAYER_NOT_FOUND = "PLAYER_NOT_FOUND";
    public static final String INSUFFICIENT_FUNDS = "INSUFFICIENT_FUNDS";

    private WebhookResponses() {
    }

    /**
     * Builds a success reply.
     * <p>
     * Extra entries are added after {@code status} and {@code balance} and never replace them.
     *
     * @param balance the player balance in major units
     * @param extraFields additional reply fields, may be null
     * @return {@code {status: "success", balance: <minor units>, ...extraFields}}
     */
    public static Map<String, Object> success(double balance, Map<String, ?> extraFields) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put(STATUS, STATUS_SUCCESS);
        response.put(BALANCE, toMinorUnits(balance));
        if (extraFields != null) {
            extraFields.forEach(response::putIfAbsent);
        }
        return Collections.unmodifiableMap(response);
    }

    public static Map<String, Object> success(double balance) {
        return success(balance, null);
    }

    /**
     * Builds an error reply.
     *
     * @param code machine-readable error code
     * @param message human-readable message
     * @return {@code {status: "error", error_code: code, error_message: message}}
     */
    public static Map<String, Object> error(String code, String message) {
        return Collections.unmodifiableMap(errorFields(code, message));
    }

    public static Map<String, Object> playerNotFound() {
        return error(PLAYER_NOT_FOUND, "Player not found");
    }

    /**
     * Builds an insufficient funds reply carrying the current balance.
     *
     * @param balance the player balance in major units
     * @return the error reply with a {@code balance} field in minor units
     */
    public static Map<String, Object> insufficientFunds(double balance) {
        Map<String, Object> response = errorFields(INSUFFICIENT_FUNDS, "Insufficient funds");
        response.put(BALANCE, toMinorUnits(balance));
        return Collections.unmodifiableMap(response);
    }

    /**
     * Builds the reply for a transaction the operator has already applied.
     *
     * @param balance the player balance in major units
     * @return a success reply flagged with {@code already_processed: true}
     */
    public static Map<String, Object> alreadyProcessed(double balance) {
        return success(balance, Map.of(ALREADY_PROCESSED, true));
    }

    /**
     * Converts a major-unit amount to minor units, truncating toward zero.
     *
     * @param majorUnits amount in major units
     * @return amount in minor units
     * @throws NumberFormatException if the amount is NaN or infinite
     * @throws ArithmeticException if the amount in minor units does not fit in a {@code long}
     */
    public static long toMinorUnits(double majorUnits) {
        return BigDecimal.valueOf(majorUnits)
                .movePointRight(2)
                .setScale(0, RoundingMode.DOWN)
                .longValueExact();
    }

    private static Map<String, Object> errorFields(String code, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put(STATUS, STATUS_ERROR);
        response.put(ERROR_CODE, code);
        response.put(ERROR_MESSAGE, message);
        return response;
    }
}
