package com.couponengine.tokens;

import lombok.Value;

import java.time.Instant;

/**
 * Token string and its detached signature, as allocated at issuance.
 */
@Value
public class SignedCouponToken {
    String token;
    String signature;
    Instant issuedAt;
}
