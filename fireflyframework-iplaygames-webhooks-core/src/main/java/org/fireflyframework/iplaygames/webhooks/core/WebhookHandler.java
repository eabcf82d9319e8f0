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

package org.fireflyframework.iplaygames.webhooks.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.iplaygames.webhooks.core.domain.WebhookEvent;
import org.fireflyframework.iplaygames.webhooks.core.exception.InvalidSignatureException;
import org.fireflyframework.iplaygames.webhooks.core.exception.MalformedPayloadException;
import org.fireflyframework.iplaygames.webhooks.core.parser.WebhookPayloadParser;
import org.fireflyframework.iplaygames.webhooks.core.response.WebhookResponses;
import org.fireflyframework.iplaygames.webhooks.core.signature.WebhookSignatureVerifier;

import java.util.Map;

/**
 * Entry point for handling IPlayGames webhooks.
 * <p>
 * The only state is the shared webhook secret, fixed at construction. Instances are safe
 * for concurrent use by any number of requests.
 * <p>
 * <b>Example:</b>
 * <pre>
 * {@code
 * WebhookHandler handler = new WebhookHandler(secret);
 * WebhookEvent event = handler.verifyAndParse(body, request.getHeader("X-Signature"));
 * if (event.isBet()) {
 *     // debit event.getAmountMinorUnits() from event.getPlayerId()
 *     return handler.successResponse(newBalance, null);
 * }
 * }
 * </pre>
 * This class does not log. Failures are reported to the caller, which owns logging and
 * retry policy.
 */
public class WebhookHandler {

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookPayloadParser payloadParser;

    /**
     * Creates a handler.
     *
     * @param secret the webhook secret shared with IPlayGames
     * @throws IllegalArgumentException if the secret is null or blank
     */
    public WebhookHandler(String secret) {
        this(secret, new ObjectMapper());
    }

    public WebhookHandler(String secret, ObjectMapper objectMapper) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("webhook secret is required");
        }
        this.signatureVerifier = new WebhookSignatureVerifier(secret);
        this.payloadParser = new WebhookPayloadParser(objectMapper);
    }

    /**
     * Verifies a webhook signature.
     *
     * @param payload the raw request body
     * @param signature the hex signature sent with the request
     * @return true if the payload was signed with this handler's secret
     */
    public boolean verify(byte[] payload, String signature) {
        return signatureVerifier.verify(payload, signature);
    }

    /**
     * Parses a webhook body without checking its signature.
     *
     * @param payload the raw request body
     * @return the normalized event
     * @throws MalformedPayloadException if the body is not a JSON object
     */
    public WebhookEvent parse(byte[] payload) {
        return payloadParser.parse(payload);
    }

    /**
     * Verifies and then parses a webhook. The body is never parsed unless the signature is valid.
     *
     * @param payload the raw request body
     * @param signature the hex signature sent with the request
     * @return the normalized event
     * @throws InvalidSignatureException if the signature does not match
     * @throws MalformedPayloadException if the signature matches but the body is not a JSON object
     */
    public WebhookEvent verifyAndParse(byte[] payload, String signature) {
        if (!verify(payload, signature)) {
            throw new InvalidSignatureException();
        }
        return parse(payload);
    }

    /**
     * Computes the signature IPlayGames would send for a payload.
     *
     * @param payload the raw request body
     * @return the lowercase hex signature
     */
    public String sign(byte[] payload) {
        return signatureVerifier.sign(payload);
    }

    public Map<String, Object> successResponse(double balance, Map<String, ?> extraFields) {
        return WebhookResponses.success(balance, extraFields);
    }

    public Map<String, Object> errorResponse(String code, String message) {
        return WebhookResponses.error(code, message);
    }

    public Map<String, Object> playerNotFoundResponse() {
        return WebhookResponses.playerNotFound();
    }

    public Map<String, Object> insufficientFundsResponse(double balance) {
        return WebhookResponses.insufficientFunds(balance);
    }

    public Map<String, Object> alreadyProcessedResponse(double balance) {
        return WebhookResponses.alreadyProcessed(balance);
    }
}
