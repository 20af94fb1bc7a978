package com.couponengine.validation;

import lombok.Builder;
import lombok.Value;

/**
 * Usage counters of one coupon.
 */
@Value
@Builder
public class CouponUsageStats {
    Long couponId;
    String couponCode;
    int currentUses;
    Integer maxUses;
    /**
     * Null when the coupon has no usage limit.
     */
    Integer remainingUses;
    double usagePercentage;
    boolean maxUsesReached;
}
