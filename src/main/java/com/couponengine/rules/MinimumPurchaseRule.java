package com.couponengine.rules;

import com.couponengine.coupons.Coupon;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Rule that enforces the coupon's minimum purchase amount, when one is set.
 */
@Component
@Order(100)
public class MinimumPurchaseRule implements RedemptionRule {

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        Coupon coupon = context.getCoupon();
        BigDecimal purchaseAmount = context.getPurchaseAmount();

        if (purchaseAmount != null && !coupon.meetsMinimumPurchase(purchaseAmount)) {
            return RuleResult.fail(ViolationType.MINIMUM_PURCHASE_NOT_MET,
                String.format("Purchase amount %s does not meet minimum requirement of %s",
                    purchaseAmount, coupon.getMinimumPurchaseAmount()));
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "MinimumPurchase";
    }
}
