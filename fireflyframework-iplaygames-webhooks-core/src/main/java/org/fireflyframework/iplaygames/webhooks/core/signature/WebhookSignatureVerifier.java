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

package org.fireflyframework.iplaygames.webhooks.core.signature;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Objects;

/**
 * IPlayGames webhook signature verifier.
 * <p>
 * The sender signs the exact raw request body with HMAC SHA256 keyed by the shared webhook
 * secret and sends the lowercase hex digest alongside the request.
 * <p>
 * Instances are immutable and safe to share between threads: a new {@link Mac} is created
 * for every computation.
 */
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec secretKey;

    public WebhookSignatureVerifier(String secret) {
        Objects.requireNonNull(secret, "secret");
        this.secretKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    /**
     * Checks that the signature was produced from the payload with the shared secret.
     * <p>
     * Never throws: a missing, malformed or mismatching signature is reported as {@code false}.
     *
     * @param payload the raw request body
     * @param signatureHex the hex signature sent with the request
     * @return true if the signature is valid
     */
    public boolean verify(byte[] payload, String signatureHex) {
        if (payload == null || signatureHex == null) {
            return false;
        }
        return constantTimeEquals(sign(payload), signatureHex);
    }

    /**
     * Computes the signature of a payload.
     *
     * @param payload the raw request body
     * @return the lowercase hex HMAC SHA256 digest
     */
    public String sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(secretKey);
            return HEX.formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            // every JRE ships HmacSHA256
            throw new IllegalStateException("Failed to compute signature", e);
        }
    }

    /**
     * Constant-time string comparison to prevent timing attacks.
     * A length mismatch returns early since the length alone reveals no digest content.
     */
    private boolean constantTimeEquals(String expected, String actual) {
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] actualBytes = actual.getBytes(StandardCharsets.UTF_8);
        if (expectedBytes.length != actualBytes.length) {
            return false;
        }
        return MessageDigest.isEqual(expectedBytes, actualBytes);
    }
}
