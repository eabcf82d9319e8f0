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

package org.fireflyframework.iplaygames.webhooks.web.error;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.iplaygames.webhooks.core.exception.InvalidSignatureException;
import org.fireflyframework.iplaygames.webhooks.core.exception.MalformedPayloadException;
import org.fireflyframework.iplaygames.webhooks.web.metrics.WebhookMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebhookExceptionHandler Tests")
class WebhookExceptionHandlerTest {

    private MeterRegistry meterRegistry;
    private WebhookExceptionHandler exceptionHandler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        exceptionHandler = new WebhookExceptionHandler(new WebhookMetricsService(meterRegistry));
    }

    @Test
    @DisplayName("Should map an oversized body to 413 with an error reply")
    void shouldMapBufferLimitToPayloadTooLarge() {
        ResponseEntity<Map<String, Object>> response = exceptionHandler.handleBufferLimit(
                new DataBufferLimitException("Exceeded limit on max bytes to buffer : 1048576"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        assertThat(response.getBody())
                .containsEntry("status", "error")
                .containsEntry("error_code", WebhookExceptionHandler.REQUEST_REJECTED);
        assertThat(rejections("413")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should map an invalid signature to 401")
    void shouldMapInvalidSignatureToUnauthorized() {
        ResponseEntity<Map<String, Object>> response =
                exceptionHandler.handleInvalidSignature(new InvalidSignatureException());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody()).containsEntry("error_code", "INVALID_SIGNATURE");
        assertThat(rejections("INVALID_SIGNATURE")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should map a malformed payload to 400 without echoing parser details")
    void shouldMapMalformedPayloadToBadRequest() {
        ResponseEntity<Map<String, Object>> response = exceptionHandler.handleMalformedPayload(
                new MalformedPayloadException("Numeric value out of range: 18446744073709551716"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody())
                .containsEntry("error_code", "MALFORMED_PAYLOAD")
                .containsEntry("error_message", "Malformed webhook payload");
    }

    @Test
    @DisplayName("Should keep the status of a rejected request")
    void shouldKeepResponseStatus() {
        ResponseEntity<Map<String, Object>> response = exceptionHandler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Content-Type must be one of: application/json"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
        assertThat(response.getBody())
                .containsEntry("error_message", "Content-Type must be one of: application/json");
    }

    private double rejections(String reason) {
        Counter counter = meterRegistry.find("iplaygames.webhooks.rejected").tag("reason", reason).counter();
        return counter != null ? counter.count() : 0.0;
    }
}
