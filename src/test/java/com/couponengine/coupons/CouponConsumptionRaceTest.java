package com.couponengine.coupons;

import com.couponengine.campaigns.Campaign;
import com.couponengine.campaigns.CampaignRepository;
import com.couponengine.campaigns.CampaignStatus;
import com.couponengine.campaigns.CampaignStore;
import com.couponengine.common.exception.CouponNotUsableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent use consumption against the database-backed stores.
 *
 * Not transactional: every thread must commit on its own for the conditional UPDATE to be contended.
 */
@SpringBootTest
@ActiveProfiles("test")
class CouponConsumptionRaceTest {

    private static final int THREADS = 8;
    private static final int ROUNDS = 5;

    @Autowired
    private CouponLifecycleService lifecycleService;

    @Autowired
    private CouponIssuanceService issuanceService;

    @Autowired
    private CouponStore couponStore;

    @Autowired
    private CampaignStore campaignStore;

    @Autowired
    private CouponRepository couponRepository;

    @Autowired
    private CampaignRepository campaignRepository;

    private Campaign campaign;

    @BeforeEach
    void setUp() {
        campaign = campaignStore.save(new Campaign("Race Test", CampaignStatus.ACTIVE,
            null, Instant.now().plus(10, ChronoUnit.DAYS), Discount.none(), 0, null));
    }

    @AfterEach
    void tearDown() {
        couponRepository.deleteAll();
        campaignRepository.deleteAll();
    }

    @Test
    void testExactlyOneThreadTakesTheLastUse() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            for (int round = 0; round < ROUNDS; round++) {
                Coupon coupon = issuanceService.issueCoupon(IssueCouponCommand.builder()
                    .campaignId(campaign.getId())
                    .maxUses(1)
                    .build());

                int successes = race(executor, coupon.getId());

                Coupon stored = couponStore.findById(coupon.getId()).orElseThrow();
                assertEquals(1, successes, "round " + round);
                assertEquals(1, stored.getCurrentUses(), "round " + round);
                assertEquals(CouponStatus.USED_UP, stored.getStatus(), "round " + round);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(ROUNDS, campaignStore.findById(campaign.getId()).orElseThrow().getUsedCoupons());
    }

    private int race(ExecutorService executor, Long couponId) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            results.add(executor.submit(() -> {
                start.await();
                try {
                    lifecycleService.consumeUse(couponId);
                    return true;
                } catch (CouponNotUsableException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int successes = 0;
        for (Future<Boolean> result : results) {
            if (result.get(30, TimeUnit.SECONDS)) {
                successes++;
            }
        }
        return successes;
    }
}
