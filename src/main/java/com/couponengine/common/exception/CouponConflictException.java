package com.couponengine.common.exception;

/**
 * Thrown when a compare-and-set on a coupon loses to a concurrent write.
 *
 * The coupon itself may still be usable; re-reading and trying again can succeed.
 */
public class CouponConflictException extends CouponEngineException {

    private final Long couponId;

    public CouponConflictException(Long couponId, String operation) {
        super(String.format("Coupon %s was modified concurrently during %s", couponId, operation));
        this.couponId = couponId;
    }

    public Long getCouponId() {
        return couponId;
    }
}
