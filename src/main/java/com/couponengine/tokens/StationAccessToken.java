package com.couponengine.tokens;

import lombok.Value;

import java.time.Instant;

/**
 * Decoded claims of a short-lived token that authorizes one dispenser at one station.
 */
@Value
public class StationAccessToken {
    Long stationId;
    String dispenserId;
    String nonce;
    Instant issuedAt;
    Instant expiresAt;

    public boolean isExpiredAt(Instant instant) {
        return instant.isAfter(expiresAt);
    }
}
