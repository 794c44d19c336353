package com.guardrails.engine.approval;

import com.guardrails.core.exception.GuardrailException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Issues and verifies time-boxed approval tokens.
 *
 * Token format: {@code <issuedAtEpochSeconds>.<hex HMAC-SHA256(secret, executionId:issuedAtEpochSeconds)>}.
 * Verification compares signatures in constant time and fails closed on any parse problem.
 */
public class ApprovalTokenSigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Duration MAX_CLOCK_SKEW = Duration.ofSeconds(60);
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec key;
    private final Duration window;
    private final Clock clock;

    public ApprovalTokenSigner(byte[] secret, Duration window, Clock clock) {
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("Approval secret must not be empty");
        }
        this.key = new SecretKeySpec(secret.clone(), ALGORITHM);
        this.window = window;
        this.clock = clock;
    }

    public ApprovalTokenSigner(String secret, Duration window, Clock clock) {
        this(secret == null ? null : secret.getBytes(StandardCharsets.UTF_8), window, clock);
    }

    public ApprovalToken issue(UUID executionId) {
        Instant issuedAt = clock.instant();
        long epochSeconds = issuedAt.getEpochSecond();
        String value = epochSeconds + "." + sign(executionId, epochSeconds);
        return new ApprovalToken(value, Instant.ofEpochSecond(epochSeconds),
            Instant.ofEpochSecond(epochSeconds).plus(window));
    }

    public TokenVerification verify(UUID executionId, String token) {
        if (executionId == null || token == null) {
            return TokenVerification.INVALID;
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1) {
            return TokenVerification.INVALID;
        }

        long epochSeconds;
        byte[] presented;
        try {
            epochSeconds = Long.parseLong(token.substring(0, dot));
            presented = HEX.parseHex(token.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            return TokenVerification.INVALID;
        }

        byte[] expected = HEX.parseHex(sign(executionId, epochSeconds));
        if (!MessageDigest.isEqual(expected, presented)) {
            return TokenVerification.INVALID;
        }

        Instant issuedAt = Instant.ofEpochSecond(epochSeconds);
        Instant now = clock.instant();
        if (issuedAt.isAfter(now.plus(MAX_CLOCK_SKEW))) {
            return TokenVerification.INVALID;
        }
        if (!now.isBefore(issuedAt.plus(window))) {
            return TokenVerification.STALE;
        }
        return TokenVerification.VALID;
    }

    public Duration window() {
        return window;
    }

    private String sign(UUID executionId, long epochSeconds) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal((executionId + ":" + epochSeconds).getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new GuardrailException("TOKEN_SIGNING_FAILED", "Unable to compute approval signature", e);
        }
    }
}
