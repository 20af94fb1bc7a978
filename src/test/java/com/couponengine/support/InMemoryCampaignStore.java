package com.couponengine.support;

import com.couponengine.campaigns.Campaign;
import com.couponengine.campaigns.CampaignStore;
import com.couponengine.common.exception.CampaignNotFoundException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Campaign store holding the campaign objects directly; counters are bumped under the store lock.
 */
public class InMemoryCampaignStore implements CampaignStore {

    private final Map<Long, Campaign> campaigns = new HashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public synchronized Optional<Campaign> findById(Long campaignId) {
        return Optional.ofNullable(campaigns.get(campaignId));
    }

    @Override
    public synchronized Campaign save(Campaign campaign) {
        if (campaign.getId() == null) {
            campaign.setId(ids.incrementAndGet());
        }
        campaigns.put(campaign.getId(), campaign);
        return campaign;
    }

    @Override
    public synchronized boolean incrementGeneratedCoupons(Long campaignId) {
        Campaign campaign = campaigns.get(campaignId);
        if (campaign == null || campaign.hasReachedCapacity()) {
            return false;
        }
        campaign.setGeneratedCoupons(campaign.getGeneratedCoupons() + 1);
        return true;
    }

    @Override
    public synchronized boolean reserveGeneratedCoupons(Long campaignId, int count) {
        Campaign campaign = campaigns.get(campaignId);
        if (campaign == null) {
            return false;
        }
        Integer remaining = campaign.getRemainingCapacity();
        if (remaining != null && count > remaining) {
            return false;
        }
        campaign.setGeneratedCoupons(campaign.getGeneratedCoupons() + count);
        return true;
    }

    @Override
    public synchronized void incrementUsedCoupons(Long campaignId) {
        Campaign campaign = campaigns.get(campaignId);
        if (campaign == null) {
            throw new CampaignNotFoundException(campaignId);
        }
        campaign.setUsedCoupons(campaign.getUsedCoupons() + 1);
    }
}
