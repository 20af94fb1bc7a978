package com.couponengine.common.exception;

/**
 * Base exception for all coupon engine exceptions.
 */
public class CouponEngineException extends RuntimeException {

    public CouponEngineException(String message) {
        super(message);
    }

    public CouponEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
