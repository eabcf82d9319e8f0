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

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.iplaygames.webhooks.core.exception.MalformedPayloadException;

import java.util.function.Predicate;

/**
 * Typed, alias-aware reads from a webhook JSON object.
 * <p>
 * Each read takes an ordered list of candidate keys: the first key whose value has the
 * expected JSON type wins. A value of the wrong type counts as absent, so a later alias is
 * still consulted. A number outside the range of the target type is rejected, never wrapped.
 */
final class PayloadFields {

    private final JsonNode root;

    PayloadFields(JsonNode root) {
        this.root = root;
    }

    /**
     * Reads a string. Empty strings count as absent.
     *
     * @return the first non-empty string value, or an empty string
     */
    String text(String... keys) {
        JsonNode node = first(n -> n.isTextual() && !n.textValue().isEmpty(), keys);
        return node != null ? node.textValue() : "";
    }

    /**
     * Reads an integral number. Fractional values are truncated toward zero.
     *
     * @return the value, or {@code null} if no candidate holds a number
     * @throws MalformedPayloadException if the number does not fit in a {@code long}
     */
    Long longValue(String... keys) {
        JsonNode node = first(JsonNode::isNumber, keys);
        if (node == null) {
            return null;
        }
        if (!node.canConvertToLong()) {
            throw outOfRange(node);
        }
        return node.longValue();
    }

    /**
     * Reads an integral number. Fractional values are truncated toward zero.
     *
     * @return the value, or {@code null} if no candidate holds a number
     * @throws MalformedPayloadException if the number does not fit in an {@code int}
     */
    Integer intValue(String... keys) {
        JsonNode node = first(JsonNode::isNumber, keys);
        if (node == null) {
            return null;
        }
        if (!node.canConvertToInt()) {
            throw outOfRange(node);
        }
        return node.intValue();
    }

    Double doubleValue(String... keys) {
        JsonNode node = first(JsonNode::isNumber, keys);
        return node != null ? node.doubleValue() : null;
    }

    /**
     * Reads a boolean.
     *
     * @return the value, or {@code false} if no candidate holds a boolean
     */
    boolean flag(String... keys) {
        JsonNode node = first(JsonNode::isBoolean, keys);
        return node != null && node.booleanValue();
    }

    private MalformedPayloadException outOfRange(JsonNode node) {
        return new MalformedPayloadException("Numeric value out of range: " + node.asText());
    }

    private JsonNode first(Predicate<JsonNode> accepts, String... keys) {
        for (String key : keys) {
            JsonNode node = root.get(key);
            if (node != null && accepts.test(node)) {
                return node;
            }
        }
        return null;
    }
}
