package com.couponengine.validation;

import lombok.Builder;
import lombok.Value;

/**
 * Quick preview of a coupon, answered without redemption context.
 */
@Value
@Builder
public class PreValidationResult {

    boolean exists;
    boolean active;
    boolean expired;
    Long campaignId;
    String campaignName;
    String discountSummary;

    /**
     * Unknown tokens report as inactive and expired so a client never offers them.
     */
    public static PreValidationResult notFound() {
        return PreValidationResult.builder()
            .exists(false)
            .active(false)
            .expired(true)
            .build();
    }
}
