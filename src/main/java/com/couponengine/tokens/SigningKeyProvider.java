package com.couponengine.tokens;

/**
 * Supplies signers for coupon tokens (scoped per campaign) and station access tokens.
 */
public interface SigningKeyProvider {

    /**
     * Signer for tokens issued under the given campaign.
     */
    TokenSigner couponSigner(Long campaignId);

    /**
     * Asymmetric signer for station/dispenser access tokens.
     */
    TokenSigner stationSigner();
}
