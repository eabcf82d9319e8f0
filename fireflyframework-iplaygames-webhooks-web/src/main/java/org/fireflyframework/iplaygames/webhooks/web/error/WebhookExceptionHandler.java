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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iplaygames.webhooks.core.exception.InvalidSignatureException;
import org.fireflyframework.iplaygames.webhooks.core.exception.MalformedPayloadException;
import org.fireflyframework.iplaygames.webhooks.core.response.WebhookResponses;
import org.fireflyframework.iplaygames.webhooks.web.metrics.WebhookMetricsService;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Maps webhook rejections to HTTP statuses.
 * <p>
 * The body of every rejection uses the same error reply shape as a business error, so the
 * sender can always read {@code error_code}.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class WebhookExceptionHandler {

    public static final String REQUEST_REJECTED = "REQUEST_REJECTED";

    private final WebhookMetricsService metricsService;

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSignature(InvalidSignatureException e) {
        log.warn("Rejected webhook with invalid signature");
        metricsService.recordWebhookRejected(e.getErrorCode());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(WebhookResponses.error(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(MalformedPayloadException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedPayload(MalformedPayloadException e) {
        log.warn("Rejected signed webhook with malformed payload: {}", e.getMessage());
        metricsService.recordWebhookRejected(e.getErrorCode());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(WebhookResponses.error(e.getErrorCode(), "Malformed webhook payload"));
    }

    @ExceptionHandler(DataBufferLimitException.class)
    public ResponseEntity<Map<String, Object>> handleBufferLimit(DataBufferLimitException e) {
        log.warn("Rejected webhook exceeding the in-memory body limit: {}", e.getMessage());
        metricsService.recordWebhookRejected(String.valueOf(HttpStatus.PAYLOAD_TOO_LARGE.value()));
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(WebhookResponses.error(REQUEST_REJECTED, "Payload exceeds maximum allowed size"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException e) {
        metricsService.recordWebhookRejected(String.valueOf(e.getStatusCode().value()));
        return ResponseEntity.status(e.getStatusCode())
                .body(WebhookResponses.error(REQUEST_REJECTED, e.getReason()));
    }
}
