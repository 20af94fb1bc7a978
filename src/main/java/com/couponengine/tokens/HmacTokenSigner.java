package com.couponengine.tokens;

import com.couponengine.common.exception.TokenSigningException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * HMAC-SHA256 signer. A fresh {@link Mac} is created per call since Mac is not thread-safe.
 */
public class HmacTokenSigner implements TokenSigner {

    static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public HmacTokenSigner(byte[] secret) {
        if (secret == null || secret.length < 16) {
            throw new TokenSigningException("HMAC secret must be at least 16 bytes");
        }
        this.key = new SecretKeySpec(secret.clone(), ALGORITHM);
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public byte[] sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new TokenSigningException("Unable to compute " + ALGORITHM + " signature", e);
        }
    }

    @Override
    public boolean verify(byte[] payload, byte[] signature) {
        if (signature == null || signature.length == 0) {
            return false;
        }
        return MessageDigest.isEqual(sign(payload), signature);
    }
}
