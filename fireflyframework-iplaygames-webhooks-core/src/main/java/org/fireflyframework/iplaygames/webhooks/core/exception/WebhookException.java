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

package org.fireflyframework.iplaygames.webhooks.core.exception;

/**
 * Base class for failures raised while handling an inbound IPlayGames webhook.
 * <p>
 * Every subclass is local to one request and recoverable by the caller, which typically
 * answers with a client-error status and moves on.
 */
public abstract class WebhookException extends RuntimeException {

    protected WebhookException(String message) {
        super(message);
    }

    protected WebhookException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Gets the error code reported back to the sender.
     *
     * @return the error code
     */
    public abstract String getErrorCode();
}
