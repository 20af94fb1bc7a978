package com.couponengine.common.exception;

/**
 * Thrown when a campaign is not found.
 */
public class CampaignNotFoundException extends CouponEngineException {

    public CampaignNotFoundException(Long campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
