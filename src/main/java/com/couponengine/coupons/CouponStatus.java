package com.couponengine.coupons;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states for a coupon.
 */
public enum CouponStatus {
    /**
     * Coupon can be redeemed.
     */
    ACTIVE,

    /**
     * Coupon is temporarily disabled. Can be reactivated.
     */
    INACTIVE,

    /**
     * Validity window has passed. Terminal.
     */
    EXPIRED,

    /**
     * Every allowed use has been consumed. Terminal.
     */
    USED_UP,

    /**
     * Cancelled by an administrator. Terminal.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == EXPIRED || this == USED_UP || this == CANCELLED;
    }

    public boolean allowsUsage() {
        return this == ACTIVE;
    }

    public boolean canChangeTo(CouponStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<CouponStatus> allowedTargets() {
        switch (this) {
            case ACTIVE:
                return EnumSet.of(INACTIVE, EXPIRED, USED_UP, CANCELLED);
            case INACTIVE:
                return EnumSet.of(ACTIVE, EXPIRED, CANCELLED);
            default:
                return EnumSet.noneOf(CouponStatus.class);
        }
    }
}
