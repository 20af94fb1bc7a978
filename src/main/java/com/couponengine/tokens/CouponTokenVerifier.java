package com.couponengine.tokens;

import com.couponengine.coupons.Coupon;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Checks coupon token format, signature and freshness, and verifies station access tokens.
 *
 * Every check fails closed: anything that cannot be decoded is rejected.
 */
@Component
@Slf4j
public class CouponTokenVerifier {

    private final SigningKeyProvider keyProvider;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration maxTokenAge;

    public CouponTokenVerifier(SigningKeyProvider keyProvider,
                               ObjectMapper objectMapper,
                               Clock clock,
                               @Value("${coupon-engine.tokens.max-age:24h}") Duration maxTokenAge) {
        this.keyProvider = keyProvider;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxTokenAge = maxTokenAge;
    }

    /**
     * Structural check only; no cryptography.
     */
    public boolean isWellFormed(String token) {
        return CouponToken.parse(token).isPresent();
    }

    /**
     * Recompute the expected signature from the presented token and the coupon record's
     * immutable fields, and compare it with the given signature.
     *
     * A missing or empty signature never verifies.
     */
    public boolean verifySignature(String token, String signature, Coupon coupon) {
        if (token == null || signature == null || signature.isBlank()) {
            log.warn("Rejecting unsigned token for coupon {}", coupon.getId());
            return false;
        }
        if (coupon.getCampaignId() == null || coupon.getCouponCode() == null || coupon.getIssuedAt() == null) {
            log.warn("Coupon {} lacks signed issuance fields", coupon.getId());
            return false;
        }

        Optional<byte[]> signatureBytes = decodeCanonical(signature);
        if (signatureBytes.isEmpty()) {
            log.warn("Signature for coupon {} is not canonical base64url", coupon.getId());
            return false;
        }

        String payload = CouponToken.canonicalPayload(
            token, coupon.getCampaignId(), coupon.getCouponCode(), coupon.getIssuedAt());
        boolean verified = keyProvider.couponSigner(coupon.getCampaignId())
            .verify(payload.getBytes(StandardCharsets.UTF_8), signatureBytes.get());

        if (!verified) {
            log.warn("Signature mismatch for coupon {} - possible tampering", coupon.getId());
        }
        return verified;
    }

    /**
     * Whether the issuance time embedded in the token is older than {@code maxAge}.
     * A token whose timestamp cannot be read is treated as stale.
     */
    public boolean isStaleByTimestamp(String token, Duration maxAge) {
        Optional<Instant> issuedAt = CouponToken.extractIssuedAt(token);
        if (issuedAt.isEmpty()) {
            log.debug("No readable timestamp in token; treating as stale");
            return true;
        }
        boolean stale = issuedAt.get().plus(maxAge).isBefore(Instant.now(clock));
        if (stale) {
            log.warn("Token issued at {} exceeds max age {}", issuedAt.get(), maxAge);
        }
        return stale;
    }

    /**
     * Staleness against the configured maximum token age.
     */
    public boolean isStale(String token) {
        return isStaleByTimestamp(token, maxTokenAge);
    }

    public Duration getMaxTokenAge() {
        return maxTokenAge;
    }

    public StationTokenVerification verifyStationToken(String token) {
        if (token == null || token.isBlank()) {
            return StationTokenVerification.rejected(StationTokenVerification.Failure.MALFORMED);
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return StationTokenVerification.rejected(StationTokenVerification.Failure.MALFORMED);
        }

        Optional<byte[]> signature = decodeCanonical(parts[1]);
        Optional<byte[]> claimsJson = decodeCanonical(parts[0]);
        if (signature.isEmpty() || claimsJson.isEmpty()) {
            return StationTokenVerification.rejected(StationTokenVerification.Failure.MALFORMED);
        }

        if (!keyProvider.stationSigner().verify(parts[0].getBytes(StandardCharsets.US_ASCII), signature.get())) {
            log.warn("Station token signature mismatch");
            return StationTokenVerification.rejected(StationTokenVerification.Failure.SIGNATURE_INVALID);
        }

        StationAccessToken accessToken;
        try {
            accessToken = objectMapper.readValue(claimsJson.get(), StationTokenClaims.class).toAccessToken();
        } catch (IOException e) {
            log.warn("Signed station token carries unreadable claims: {}", e.getMessage());
            return StationTokenVerification.rejected(StationTokenVerification.Failure.MALFORMED);
        }

        if (accessToken.getStationId() == null) {
            return StationTokenVerification.rejected(StationTokenVerification.Failure.MALFORMED);
        }
        if (accessToken.isExpiredAt(Instant.now(clock))) {
            return StationTokenVerification.expired(accessToken);
        }
        return StationTokenVerification.valid(accessToken);
    }

    /**
     * Decode unpadded base64url, rejecting any text that does not re-encode to itself.
     * The JDK decoder ignores stray low bits in the last character.
     */
    private static Optional<byte[]> decodeCanonical(String value) {
        byte[] decoded;
        try {
            decoded = Base64.getUrlDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (!CouponTokenSigner.encode(decoded).equals(value)) {
            return Optional.empty();
        }
        return Optional.of(decoded);
    }
}
