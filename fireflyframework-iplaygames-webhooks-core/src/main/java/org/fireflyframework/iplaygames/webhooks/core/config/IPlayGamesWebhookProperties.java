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

package org.fireflyframework.iplaygames.webhooks.core.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Configuration properties for receiving IPlayGames webhooks.
 * <p>
 * All properties can be configured via:
 * <ul>
 *   <li>application.yml: {@code iplaygames.webhooks.secret: whsec_...}</li>
 *   <li>Environment variables: {@code IPLAYGAMES_WEBHOOKS_SECRET=whsec_...}</li>
 *   <li>System properties: {@code -Diplaygames.webhooks.secret=whsec_...}</li>
 * </ul>
 * <p>
 * Example environment variables:
 * <pre>
 * IPLAYGAMES_WEBHOOKS_SECRET=whsec_...
 * IPLAYGAMES_WEBHOOKS_SIGNATURE_HEADER=X-Signature
 * IPLAYGAMES_WEBHOOKS_MAX_PAYLOAD_SIZE=1048576
 * IPLAYGAMES_WEBHOOKS_REQUIRE_CONTENT_TYPE=true
 * </pre>
 */
@ConfigurationProperties(prefix = "iplaygames.webhooks")
@Data
public class IPlayGamesWebhookProperties {

    /**
     * Shared secret used to sign webhook bodies (required)
     */
    @ToString.Exclude
    private String secret;

    /**
     * Request header carrying the hex signature
     */
    private String signatureHeader = "X-Signature";

    /**
     * Maximum payload size in bytes (default: 1MB)
     */
    private long maxPayloadSize = 1048576;

    /**
     * Enable payload size validation
     */
    private boolean validatePayloadSize = true;

    /**
     * Require Content-Type header
     */
    private boolean requireContentType = true;

    /**
     * Allowed Content-Type values
     */
    private List<String> allowedContentTypes = List.of("application/json");
}
