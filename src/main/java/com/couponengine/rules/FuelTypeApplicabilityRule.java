package com.couponengine.rules;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that restricts a coupon to its applicable fuel types (case-insensitive).
 * An empty fuel type set means all.
 */
@Component
@Order(90)
public class FuelTypeApplicabilityRule implements RedemptionRule {

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        String fuelType = context.getFuelType();

        if (fuelType != null && !context.getCoupon().appliesToFuelType(fuelType)) {
            return RuleResult.fail(ViolationType.FUEL_TYPE_MISMATCH,
                String.format("Coupon is not valid for fuel type %s", fuelType));
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "FuelTypeApplicability";
    }
}
