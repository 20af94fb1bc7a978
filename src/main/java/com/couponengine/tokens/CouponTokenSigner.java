package com.couponengine.tokens;

import com.couponengine.common.exception.TokenSigningException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds and signs coupon tokens and station access tokens.
 */
@Component
@Slf4j
public class CouponTokenSigner {

    private static final String NONCE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int NONCE_LENGTH = 8;
    private static final int SEQUENCE_MODULUS = 1_000_000;

    private final SigningKeyProvider keyProvider;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final AtomicInteger sequence;

    public CouponTokenSigner(SigningKeyProvider keyProvider, ObjectMapper objectMapper, Clock clock) {
        this.keyProvider = keyProvider;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sequence = new AtomicInteger(random.nextInt(SEQUENCE_MODULUS));
    }

    /**
     * Allocate a token for a new coupon and sign it together with the coupon's
     * immutable issuance fields.
     *
     * @param campaignId owning campaign
     * @param couponCode human-readable coupon code, 6-50 chars of [A-Z0-9]
     * @param issuedAt issuance time; truncated to whole seconds since the token carries seconds
     * @return the token, its signature and the truncated issuance time
     */
    public SignedCouponToken signCouponToken(Long campaignId, String couponCode, Instant issuedAt) {
        Instant issued = issuedAt.truncatedTo(ChronoUnit.SECONDS);
        CouponToken couponToken = new CouponToken(
            campaignId,
            Math.floorMod(sequence.incrementAndGet(), SEQUENCE_MODULUS),
            issued,
            nonce(),
            couponCode);

        String token = couponToken.encode();
        if (CouponToken.parse(token).isEmpty()) {
            throw new IllegalArgumentException("Cannot build a well-formed token for coupon code " + couponCode);
        }

        String payload = CouponToken.canonicalPayload(token, campaignId, couponCode, issued);
        byte[] signature = keyProvider.couponSigner(campaignId).sign(payload.getBytes(StandardCharsets.UTF_8));

        log.debug("Signed token for coupon {} in campaign {}", couponCode, campaignId);
        return new SignedCouponToken(token, encode(signature), issued);
    }

    /**
     * Build a dispenser access token: {@code base64url(claims) + "." + base64url(signature)}.
     */
    public String signStationToken(Long stationId, String dispenserId, Instant expiresAt) {
        Instant now = Instant.now(clock);
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("Station token expiration must be in the future: " + expiresAt);
        }

        StationTokenClaims claims = new StationTokenClaims(
            stationId, dispenserId, nonce(), now.getEpochSecond(), expiresAt.getEpochSecond());

        String payloadSegment;
        try {
            payloadSegment = encode(objectMapper.writeValueAsBytes(claims));
        } catch (JsonProcessingException e) {
            throw new TokenSigningException("Unable to serialize station token claims", e);
        }

        byte[] signature = keyProvider.stationSigner().sign(payloadSegment.getBytes(StandardCharsets.US_ASCII));

        log.info("Signed access token for station {} dispenser {} expiring at {}",
            stationId, dispenserId, expiresAt);
        return payloadSegment + "." + encode(signature);
    }

    static String encode(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private String nonce() {
        StringBuilder nonce = new StringBuilder(NONCE_LENGTH);
        for (int i = 0; i < NONCE_LENGTH; i++) {
            nonce.append(NONCE_ALPHABET.charAt(random.nextInt(NONCE_ALPHABET.length())));
        }
        return nonce.toString();
    }
}
