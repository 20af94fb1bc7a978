package com.couponengine.tokens;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JSON payload of a station access token. Keys are kept short to fit a QR code.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
class StationTokenClaims {

    @JsonProperty("s")
    private Long stationId;

    @JsonProperty("d")
    private String dispenserId;

    @JsonProperty("n")
    private String nonce;

    /**
     * Issued at, epoch seconds.
     */
    @JsonProperty("t")
    private long issuedAt;

    /**
     * Expires at, epoch seconds.
     */
    @JsonProperty("exp")
    private long expiresAt;

    StationAccessToken toAccessToken() {
        return new StationAccessToken(stationId, dispenserId, nonce,
            Instant.ofEpochSecond(issuedAt), Instant.ofEpochSecond(expiresAt));
    }
}
