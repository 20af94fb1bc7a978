package com.couponengine.common.exception;

/**
 * Thrown when a campaign cannot accept an operation, e.g. issuing into a paused or full campaign.
 */
public class InvalidCampaignStateException extends CouponEngineException {

    public InvalidCampaignStateException(Long campaignId, String reason) {
        super(String.format("Campaign %s cannot accept operation: %s", campaignId, reason));
    }
}
