package com.couponengine.tokens;

/**
 * Signature algorithm abstraction used for coupon and station tokens.
 *
 * Implementations must be thread-safe and deterministic for a given key where the
 * algorithm allows it.
 */
public interface TokenSigner {

    /**
     * JCA name of the algorithm, e.g. "HmacSHA256".
     */
    String algorithm();

    /**
     * Sign the given bytes.
     *
     * @throws com.couponengine.common.exception.TokenSigningException if this signer holds no signing key
     */
    byte[] sign(byte[] payload);

    /**
     * Verify a signature. Never throws for a bad signature; returns false instead.
     */
    boolean verify(byte[] payload, byte[] signature);
}
