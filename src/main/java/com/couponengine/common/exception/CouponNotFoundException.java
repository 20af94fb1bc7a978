package com.couponengine.common.exception;

/**
 * Thrown when a coupon is not found.
 */
public class CouponNotFoundException extends CouponEngineException {

    public CouponNotFoundException(Long couponId) {
        super("Coupon not found: " + couponId);
    }
}
