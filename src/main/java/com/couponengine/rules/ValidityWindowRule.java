package com.couponengine.rules;

import com.couponengine.coupons.Coupon;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Rule that enforces the coupon's validFrom/validUntil window.
 */
@Component
@Order(50)
public class ValidityWindowRule implements RedemptionRule {

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        Coupon coupon = context.getCoupon();
        Instant now = context.getEvaluatedAt();

        if (coupon.isNotYetValidAt(now)) {
            return RuleResult.fail(ViolationType.NOT_YET_VALID,
                String.format("Coupon is not yet valid (valid from %s)", coupon.getValidFrom()));
        }
        if (coupon.isExpiredAt(now)) {
            return RuleResult.fail(ViolationType.EXPIRED,
                String.format("Coupon has expired (valid until %s)", coupon.getValidUntil()));
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "ValidityWindow";
    }

    @Override
    public boolean appliesAtConsumption() {
        return true;
    }
}
