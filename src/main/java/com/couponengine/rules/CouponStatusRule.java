package com.couponengine.rules;

import com.couponengine.coupons.CouponStatus;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that requires the coupon to be ACTIVE.
 */
@Component
@Order(40)
public class CouponStatusRule implements RedemptionRule {

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        CouponStatus status = context.getCoupon().getStatus();

        if (status == null || !status.allowsUsage()) {
            return RuleResult.fail(ViolationType.STATUS_NOT_ACTIVE,
                String.format("Coupon is not active (status: %s)", status));
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "CouponStatus";
    }

    @Override
    public boolean appliesAtConsumption() {
        return true;
    }
}
