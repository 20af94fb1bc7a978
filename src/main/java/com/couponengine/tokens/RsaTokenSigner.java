package com.couponengine.tokens;

import com.couponengine.common.exception.TokenSigningException;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;

/**
 * SHA256withRSA signer. A signer built without a private key can only verify.
 */
public class RsaTokenSigner implements TokenSigner {

    static final String ALGORITHM = "SHA256withRSA";

    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    public RsaTokenSigner(PrivateKey privateKey, PublicKey publicKey) {
        if (publicKey == null) {
            throw new TokenSigningException("RSA public key is required");
        }
        this.privateKey = privateKey;
        this.publicKey = publicKey;
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public byte[] sign(byte[] payload) {
        if (privateKey == null) {
            throw new TokenSigningException("No RSA private key configured; signer is verify-only");
        }
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(payload);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new TokenSigningException("Unable to compute " + ALGORITHM + " signature", e);
        }
    }

    @Override
    public boolean verify(byte[] payload, byte[] signatureBytes) {
        if (signatureBytes == null || signatureBytes.length == 0) {
            return false;
        }
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initVerify(publicKey);
            signature.update(payload);
            return signature.verify(signatureBytes);
        } catch (SignatureException e) {
            // malformed signature encoding
            return false;
        } catch (GeneralSecurityException e) {
            throw new TokenSigningException("Unable to verify " + ALGORITHM + " signature", e);
        }
    }
}
