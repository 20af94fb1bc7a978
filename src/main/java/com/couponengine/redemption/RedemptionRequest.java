package com.couponengine.redemption;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request to redeem a coupon at a station.
 *
 * Identifies the coupon either by its scanned token or by its coupon code; the token
 * wins when both are given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RedemptionRequest {

    /**
     * QR token as scanned.
     */
    private String token;

    /**
     * Code typed in by the attendant when the QR cannot be scanned.
     */
    private String couponCode;

    private Long stationId;

    private String fuelType;

    private BigDecimal purchaseAmount;
}
