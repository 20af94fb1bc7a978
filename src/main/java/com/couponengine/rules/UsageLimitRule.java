package com.couponengine.rules;

import com.couponengine.coupons.Coupon;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that rejects coupons whose uses have reached maxUses. Unlimited coupons always pass.
 */
@Component
@Order(60)
public class UsageLimitRule implements RedemptionRule {

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        Coupon coupon = context.getCoupon();

        if (!coupon.hasRemainingCapacity()) {
            return RuleResult.fail(ViolationType.USAGE_LIMIT_REACHED,
                String.format("Coupon has reached maximum usage limit (%d of %d)",
                    coupon.getCurrentUses(), coupon.getMaxUses()));
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "UsageLimit";
    }

    @Override
    public boolean appliesAtConsumption() {
        return true;
    }
}
