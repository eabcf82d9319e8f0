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

package org.fireflyframework.iplaygames.webhooks.web.validation;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iplaygames.webhooks.core.config.IPlayGamesWebhookProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Validator for inbound webhook requests.
 * Checks payload size, Content-Type and the presence of the signature header before the
 * signature itself is verified.
 */
@Component
@Slf4j
public class WebhookRequestValidator {

    private final IPlayGamesWebhookProperties properties;

    public WebhookRequestValidator(IPlayGamesWebhookProperties properties) {
        this.properties = properties;
    }

    /**
     * Validates the webhook request.
     *
     * @param payload the raw request body
     * @param request the HTTP request
     * @throws ResponseStatusException if validation fails
     */
    public void validateRequest(byte[] payload, ServerHttpRequest request) {
        validatePayloadSize(payload);
        validateContentType(request);
    }

    /**
     * Validates the payload size.
     *
     * @param payload the raw request body
     * @throws ResponseStatusException if payload is too large
     */
    public void validatePayloadSize(byte[] payload) {
        if (!properties.isValidatePayloadSize()) {
            return;
        }

        long payloadSize = payload.length;
        long maxSize = properties.getMaxPayloadSize();

        if (payloadSize > maxSize) {
            log.warn("Payload size {} exceeds maximum allowed size {}", payloadSize, maxSize);
            throw new ResponseStatusException(
                    HttpStatus.PAYLOAD_TOO_LARGE,
                    String.format("Payload size %d bytes exceeds maximum allowed size %d bytes", payloadSize, maxSize)
            );
        }
    }

    /**
     * Validates the Content-Type header.
     *
     * @param request the HTTP request
     * @throws ResponseStatusException if Content-Type is invalid
     */
    public void validateContentType(ServerHttpRequest request) {
        if (!properties.isRequireContentType()) {
            return;
        }

        String contentType = request.getHeaders().getFirst("Content-Type");
        if (contentType == null || contentType.isBlank()) {
            log.warn("Content-Type header is missing");
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "Content-Type header is required"
            );
        }

        // Extract base content type (ignore charset and other parameters)
        String baseContentType = contentType.split(";")[0].trim().toLowerCase();

        List<String> allowedTypes = properties.getAllowedContentTypes();
        if (!allowedTypes.contains(baseContentType)) {
            log.warn("Invalid Content-Type: {}. Allowed types: {}", baseContentType, allowedTypes);
            throw new ResponseStatusException(
                    HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                    "Content-Type must be one of: " + String.join(", ", allowedTypes)
            );
        }
    }

    /**
     * Extracts the signature from the configured header.
     *
     * @param request the HTTP request
     * @return the signature value
     * @throws ResponseStatusException if the header is missing
     */
    public String extractSignature(ServerHttpRequest request) {
        String headerName = properties.getSignatureHeader();
        String signature = request.getHeaders().getFirst(headerName);
        if (signature == null || signature.isBlank()) {
            log.warn("Signature header {} is missing", headerName);
            throw new ResponseStatusException(
                    HttpStatus.UNAUTHORIZED,
                    "Signature header " + headerName + " is required"
            );
        }
        return signature.trim();
    }
}
