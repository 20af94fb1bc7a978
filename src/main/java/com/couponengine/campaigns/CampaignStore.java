package com.couponengine.campaigns;

import java.util.Optional;

/**
 * Campaign collaborator contract.
 *
 * Counter increments must be atomic at the storage boundary: concurrent callers on
 * different service instances must never lose an increment.
 */
public interface CampaignStore {

    Optional<Campaign> findById(Long campaignId);

    Campaign save(Campaign campaign);

    /**
     * Atomically add one to the campaign's generated-coupon counter, unless the campaign
     * has already reached {@code maxCoupons}.
     *
     * @return true if a slot was taken, false if the campaign is full or does not exist
     */
    boolean incrementGeneratedCoupons(Long campaignId);

    /**
     * Atomically add {@code count} to the generated-coupon counter, only if all of them
     * fit within {@code maxCoupons}. Nothing is reserved when they do not.
     *
     * @return true if the slots were taken
     */
    boolean reserveGeneratedCoupons(Long campaignId, int count);

    /**
     * Atomically add one to the campaign's used-coupon counter.
     *
     * @throws com.couponengine.common.exception.CampaignNotFoundException if the campaign does not exist
     */
    void incrementUsedCoupons(Long campaignId);
}
