package com.couponengine.redemption;

/**
 * Outcome of a redemption attempt.
 */
public enum RedemptionStatus {
    /**
     * A use was recorded and the discount granted.
     */
    APPROVED,

    /**
     * Nothing was recorded.
     */
    DECLINED
}
