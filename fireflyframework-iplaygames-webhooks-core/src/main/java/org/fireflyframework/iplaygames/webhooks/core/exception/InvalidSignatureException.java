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
 * Thrown by {@link org.fireflyframework.iplaygames.webhooks.core.WebhookHandler#verifyAndParse}
 * when the signature does not match the payload.
 */
public class InvalidSignatureException extends WebhookException {

    public static final String ERROR_CODE = "INVALID_SIGNATURE";

    public InvalidSignatureException() {
        super("Invalid webhook signature");
    }

    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
