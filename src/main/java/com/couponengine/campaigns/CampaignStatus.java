package com.couponengine.campaigns;

/**
 * Lifecycle status of a coupon campaign. Campaign administration owns the transitions;
 * this engine only reads the status.
 */
public enum CampaignStatus {
    DRAFT,
    /**
     * Campaign is running: coupons may be issued and redeemed.
     */
    ACTIVE,
    PAUSED,
    COMPLETED,
    CANCELLED;

    public boolean isFinal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
