package com.couponengine.rules;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that restricts a coupon to its applicable stations. An empty station set means all.
 */
@Component
@Order(80)
public class StationApplicabilityRule implements RedemptionRule {

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        Long stationId = context.getStationId();

        if (stationId != null && !context.getCoupon().appliesToStation(stationId)) {
            return RuleResult.fail(ViolationType.STATION_MISMATCH,
                String.format("Coupon is not valid at station %d", stationId));
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "StationApplicability";
    }
}
