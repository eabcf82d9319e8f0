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

import org.fireflyframework.iplaygames.webhooks.core.config.IPlayGamesWebhookProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WebhookRequestValidator.
 */
@DisplayName("WebhookRequestValidator Tests")
class WebhookRequestValidatorTest {

    private WebhookRequestValidator validator;
    private IPlayGamesWebhookProperties properties;

    @BeforeEach
    void setUp() {
        properties = new IPlayGamesWebhookProperties();
        properties.setSecret("test_secret");
        properties.setValidatePayloadSize(true);
        properties.setMaxPayloadSize(1024);
        properties.setRequireContentType(true);
        properties.setAllowedContentTypes(List.of("application/json"));

        validator = new WebhookRequestValidator(properties);
    }

    @Test
    @DisplayName("Should validate payload size within limit")
    void shouldValidatePayloadSizeWithinLimit() {
        byte[] payload = "{\"type\":\"bet\"}".getBytes(StandardCharsets.UTF_8);
        assertDoesNotThrow(() -> validator.validatePayloadSize(payload));
    }

    @Test
    @DisplayName("Should reject payload exceeding size limit")
    void shouldRejectPayloadExceedingSizeLimit() {
        properties.setMaxPayloadSize(10);

        byte[] payload = "{\"type\":\"this is a large payload\"}".getBytes(StandardCharsets.UTF_8);

        ResponseStatusException exception = assertThrows(
                ResponseStatusException.class,
                () -> validator.validatePayloadSize(payload)
        );
        assertEquals(HttpStatus.PAYLOAD_TOO_LARGE, exception.getStatusCode());
    }

    @Test
    @DisplayName("Should skip payload size check when disabled")
    void shouldSkipPayloadSizeCheckWhenDisabled() {
        properties.setMaxPayloadSize(1);
        properties.setValidatePayloadSize(false);

        assertDoesNotThrow(() -> validator.validatePayloadSize(new byte[64]));
    }

    @Test
    @DisplayName("Should validate Content-Type with charset")
    void shouldValidateContentTypeWithCharset() {
        ServerHttpRequest request = MockServerHttpRequest
                .post("/api/v1/webhooks/iplaygames")
                .header("Content-Type", "application/json; charset=utf-8")
                .build();

        assertDoesNotThrow(() -> validator.validateContentType(request));
    }

    @Test
    @DisplayName("Should reject invalid Content-Type")
    void shouldRejectInvalidContentType() {
        ServerHttpRequest request = MockServerHttpRequest
                .post("/api/v1/webhooks/iplaygames")
                .header("Content-Type", "text/plain")
                .build();

        ResponseStatusException exception = assertThrows(
                ResponseStatusException.class,
                () -> validator.validateContentType(request)
        );
        assertEquals(HttpStatus.UNSUPPORTED_MEDIA_TYPE, exception.getStatusCode());
    }

    @Test
    @DisplayName("Should reject missing Content-Type")
    void shouldRejectMissingContentType() {
        ServerHttpRequest request = MockServerHttpRequest
                .post("/api/v1/webhooks/iplaygames")
                .build();

        ResponseStatusException exception = assertThrows(
                ResponseStatusException.class,
                () -> validator.validateContentType(request)
        );
        assertEquals(HttpStatus.BAD_REQUEST, exception.getStatusCode());
    }

    @Test
    @DisplayName("Should extract signature from configured header")
    void shouldExtractSignatureFromConfiguredHeader() {
        properties.setSignatureHeader("X-IPG-Signature");

        ServerHttpRequest request = MockServerHttpRequest
                .post("/api/v1/webhooks/iplaygames")
                .header("X-IPG-Signature", " abc123 ")
                .build();

        assertEquals("abc123", validator.extractSignature(request));
    }

    @Test
    @DisplayName("Should reject missing signature header")
    void shouldRejectMissingSignatureHeader() {
        ServerHttpRequest request = MockServerHttpRequest
                .post("/api/v1/webhooks/iplaygames")
                .header("Content-Type", "application/json")
                .build();

        ResponseStatusException exception = assertThrows(
                ResponseStatusException.class,
                () -> validator.extractSignature(request)
        );
        assertEquals(HttpStatus.UNAUTHORIZED, exception.getStatusCode());
        assertTrue(exception.getReason().contains("X-Signature"));
    }
}
