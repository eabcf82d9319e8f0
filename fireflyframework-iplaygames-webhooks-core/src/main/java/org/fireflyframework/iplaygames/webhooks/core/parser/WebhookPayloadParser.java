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

package org.fireflyframework.iplaygames.webhooks.core.parser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.fireflyframework.iplaygames.webhooks.core.domain.WebhookEvent;
import org.fireflyframework.iplaygames.webhooks.core.exception.MalformedPayloadException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes raw IPlayGames webhook bodies into {@link WebhookEvent}s.
 * <p>
 * The sender has renamed some fields over time, so those are read from a primary key first
 * and a legacy key second:
 * <table>
 *   <caption>Aliased fields</caption>
 *   <tr><th>Field</th><th>Primary key</th><th>Legacy key</th></tr>
 *   <tr><td>freespin</td><td>{@code is_freespin_round}</td><td>{@code is_freespin}</td></tr>
 *   <tr><td>freespinId</td><td>{@code freespin_id}</td><td>{@code bonus_id}</td></tr>
 *   <tr><td>freespinsRemaining</td><td>{@code freespins_remaining}</td><td>{@code freespin_left}</td></tr>
 * </table>
 * Parsing only extracts; it never rejects a payload because a field is missing or because
 * the {@code type} is not one it knows.
 */
public class WebhookPayloadParser {

    private static final TypeReference<Map<String, Object>> RAW_FIELDS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectReader reader;

    public WebhookPayloadParser() {
        this(new ObjectMapper());
    }

    public WebhookPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Parses a webhook body.
     *
     * @param payload the raw request body
     * @return the normalized event
     * @throws MalformedPayloadException if the body is not a single JSON object, or an integer
     *                                   field holds a number outside the range of its type
     */
    public WebhookEvent parse(byte[] payload) {
        JsonNode root = readObject(payload);
        PayloadFields fields = new PayloadFields(root);

        return WebhookEvent.builder()
                .type(fields.text("type"))
                .playerId(fields.text("player_id"))
                .currency(fields.text("currency"))
                .timestamp(fields.text("timestamp"))
                .gameId(fields.longValue("game_id"))
                .gameType(fields.text("game_type"))
                .transactionId(fields.longValue("transaction_id"))
                .amountMinorUnits(fields.longValue("amount"))
                .sessionId(fields.text("session_id"))
                .roundId(fields.text("round_id"))
                .rewardType(fields.text("reward_type"))
                .rewardTitle(fields.text("reward_title"))
                .freespin(fields.flag("is_freespin_round", "is_freespin"))
                .freespinId(fields.text("freespin_id", "bonus_id"))
                .freespinTotal(fields.intValue("freespin_total"))
                .freespinsRemaining(fields.intValue("freespins_remaining", "freespin_left"))
                .freespinRoundNumber(fields.intValue("freespin_round_number"))
                .freespinTotalWinnings(fields.doubleValue("freespin_total_winnings"))
                .rawFields(freeze(objectMapper.convertValue(root, RAW_FIELDS_TYPE)))
                .build();
    }

    /**
     * Copies nested maps and lists into unmodifiable ones. JSON {@code null} values are kept,
     * so {@code Map.copyOf} and {@code List.copyOf} cannot be used.
     */
    private static Map<String, Object> freeze(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> copy.put(key, freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object freezeValue(Object value) {
        if (value instanceof Map) {
            return freeze((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                copy.add(freezeValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private JsonNode readObject(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new MalformedPayloadException("Webhook payload is empty");
        }

        JsonNode root;
        try {
            root = reader.readTree(payload);
        } catch (IOException e) {
            throw new MalformedPayloadException("Invalid JSON payload: " + e.getMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException("Webhook payload must be a JSON object");
        }
        return root;
    }
}
