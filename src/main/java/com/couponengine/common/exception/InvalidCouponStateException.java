package com.couponengine.common.exception;

/**
 * Thrown when attempting a status transition that the coupon's current state does not allow.
 */
public class InvalidCouponStateException extends CouponEngineException {

    public InvalidCouponStateException(Long couponId, String currentState, String operation) {
        super(String.format("Cannot perform operation '%s' on coupon %s in state %s",
            operation, couponId, currentState));
    }
}
