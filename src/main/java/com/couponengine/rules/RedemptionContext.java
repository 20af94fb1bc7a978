package com.couponengine.rules;

import com.couponengine.coupons.Coupon;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Everything a rule may look at: the presented token, the stored coupon, the
 * redemption circumstances and the evaluation time.
 *
 * Station, fuel type and purchase amount are optional; a rule whose input is absent passes.
 */
@Value
@Builder
public class RedemptionContext {

    /**
     * Token as presented by the client.
     */
    String token;

    Coupon coupon;

    Long stationId;

    String fuelType;

    BigDecimal purchaseAmount;

    Instant evaluatedAt;

    /**
     * Context for re-checking a stored coupon at consumption time.
     */
    public static RedemptionContext forConsumption(Coupon coupon, Instant now) {
        return RedemptionContext.builder()
            .token(coupon.getToken())
            .coupon(coupon)
            .evaluatedAt(now)
            .build();
    }
}
