package com.couponengine.coupons;

/**
 * Variants of a coupon's monetary benefit.
 */
public enum DiscountType {
    FIXED_AMOUNT,
    PERCENTAGE,
    /**
     * No monetary discount: the coupon only grants raffle tickets.
     */
    NONE
}
