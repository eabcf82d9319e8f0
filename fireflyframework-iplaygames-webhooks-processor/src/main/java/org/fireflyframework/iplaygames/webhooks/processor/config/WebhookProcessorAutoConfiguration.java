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

package org.fireflyframework.iplaygames.webhooks.processor.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iplaygames.webhooks.processor.dispatch.WebhookEventDispatcher;
import org.fireflyframework.iplaygames.webhooks.processor.port.WalletWebhookProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for webhook dispatch.
 * <p>
 * Applications provide a {@link WalletWebhookProcessor} bean. Without one, a fallback
 * processor answers every webhook with {@code UNSUPPORTED_EVENT}.
 */
@AutoConfiguration
@Slf4j
public class WebhookProcessorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(WalletWebhookProcessor.class)
    public WalletWebhookProcessor unsupportedWalletWebhookProcessor() {
        log.warn("No WalletWebhookProcessor configured; all IPlayGames webhooks will be answered with UNSUPPORTED_EVENT");
        return new WalletWebhookProcessor() {
            @Override
            public String getProcessorType() {
                return "UnsupportedWalletWebhookProcessor";
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookEventDispatcher webhookEventDispatcher(WalletWebhookProcessor processor) {
        return new WebhookEventDispatcher(processor);
    }
}
