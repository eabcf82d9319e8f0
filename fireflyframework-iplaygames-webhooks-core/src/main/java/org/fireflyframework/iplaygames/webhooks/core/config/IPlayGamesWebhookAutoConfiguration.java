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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iplaygames.webhooks.core.WebhookHandler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

/**
 * Auto-configuration for the IPlayGames webhook handler.
 * <p>
 * The secret is mandatory: startup fails when {@code iplaygames.webhooks.secret} is not set,
 * rather than accepting webhooks that can never be verified.
 * <p>
 * <b>Example Configuration:</b>
 * <pre>
 * iplaygames:
 *   webhooks:
 *     secret: ${IPLAYGAMES_WEBHOOKS_SECRET}
 *     signature-header: X-Signature
 * </pre>
 */
@AutoConfiguration
@EnableConfigurationProperties(IPlayGamesWebhookProperties.class)
@Slf4j
public class IPlayGamesWebhookAutoConfiguration {

    /**
     * Creates the webhook handler from the configured secret.
     *
     * @param properties the webhook properties
     * @param objectMapper the application object mapper, if any
     * @return the webhook handler
     */
    @Bean
    @ConditionalOnMissingBean
    public WebhookHandler iplayGamesWebhookHandler(IPlayGamesWebhookProperties properties,
                                                   ObjectProvider<ObjectMapper> objectMapper) {
        if (!StringUtils.hasText(properties.getSecret())) {
            throw new IllegalStateException("webhook secret not configured: set iplaygames.webhooks.secret");
        }

        log.info("Initialized IPlayGames webhook handler (signatureHeader={})", properties.getSignatureHeader());
        return new WebhookHandler(properties.getSecret(), objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
