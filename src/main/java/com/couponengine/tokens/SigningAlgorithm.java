package com.couponengine.tokens;

/**
 * Algorithm family used to sign coupon tokens.
 */
public enum SigningAlgorithm {
    HMAC,
    RSA
}
