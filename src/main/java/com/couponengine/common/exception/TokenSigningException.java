package com.couponengine.common.exception;

/**
 * Thrown when signing material or a signature algorithm is unusable.
 */
public class TokenSigningException extends CouponEngineException {

    public TokenSigningException(String message) {
        super(message);
    }

    public TokenSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
