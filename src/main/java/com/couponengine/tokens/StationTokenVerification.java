package com.couponengine.tokens;

import lombok.Value;

/**
 * Result of verifying a station access token.
 */
@Value
public class StationTokenVerification {

    public enum Failure {
        MALFORMED,
        SIGNATURE_INVALID,
        EXPIRED
    }

    boolean valid;
    /**
     * Decoded claims; present for valid and expired tokens.
     */
    StationAccessToken token;
    Failure failure;

    public static StationTokenVerification valid(StationAccessToken token) {
        return new StationTokenVerification(true, token, null);
    }

    public static StationTokenVerification expired(StationAccessToken token) {
        return new StationTokenVerification(false, token, Failure.EXPIRED);
    }

    public static StationTokenVerification rejected(Failure failure) {
        return new StationTokenVerification(false, null, failure);
    }
}
