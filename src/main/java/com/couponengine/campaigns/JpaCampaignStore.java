package com.couponengine.campaigns;

import com.couponengine.common.exception.CampaignNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link CampaignStore} backed by Spring Data JPA.
 * Counters are bumped with single UPDATE statements so the database serializes them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaCampaignStore implements CampaignStore {

    private final CampaignRepository campaignRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Campaign> findById(Long campaignId) {
        return campaignRepository.findById(campaignId);
    }

    @Override
    @Transactional
    public Campaign save(Campaign campaign) {
        Instant now = Instant.now(clock);
        if (campaign.getCreatedAt() == null) {
            campaign.setCreatedAt(now);
        }
        campaign.setUpdatedAt(now);
        return campaignRepository.save(campaign);
    }

    @Override
    @Transactional
    public boolean incrementGeneratedCoupons(Long campaignId) {
        boolean updated = campaignRepository.incrementGeneratedCoupons(campaignId, Instant.now(clock)) == 1;
        log.debug("Generated coupon slot for campaign {}: {}", campaignId, updated ? "taken" : "unavailable");
        return updated;
    }

    @Override
    @Transactional
    public boolean reserveGeneratedCoupons(Long campaignId, int count) {
        boolean reserved = campaignRepository.reserveGeneratedCoupons(campaignId, count, Instant.now(clock)) == 1;
        log.debug("Reserved {} coupon slot(s) for campaign {}: {}", count, campaignId, reserved ? "taken" : "unavailable");
        return reserved;
    }

    @Override
    @Transactional
    public void incrementUsedCoupons(Long campaignId) {
        if (campaignRepository.incrementUsedCoupons(campaignId, Instant.now(clock)) == 0) {
            throw new CampaignNotFoundException(campaignId);
        }
        log.debug("Incremented used coupons for campaign {}", campaignId);
    }
}
