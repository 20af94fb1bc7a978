package com.couponengine.coupons;

import com.couponengine.campaigns.Campaign;
import com.couponengine.common.exception.CouponConflictException;
import com.couponengine.common.exception.CouponNotFoundException;
import com.couponengine.common.exception.CouponNotUsableException;
import com.couponengine.common.exception.InvalidCouponStateException;
import com.couponengine.rules.ViolationType;
import com.couponengine.support.CouponFixtures;
import com.couponengine.support.InMemoryCampaignStore;
import com.couponengine.support.InMemoryCouponStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for coupon status transitions and use consumption.
 */
class CouponLifecycleServiceTest {

    private CouponFixtures fixtures;
    private InMemoryCouponStore couponStore;
    private InMemoryCampaignStore campaignStore;
    private CouponLifecycleService lifecycleService;
    private Campaign campaign;
    private Coupon coupon;

    @BeforeEach
    void setUp() {
        fixtures = new CouponFixtures();
        couponStore = new InMemoryCouponStore();
        campaignStore = new InMemoryCampaignStore();
        lifecycleService = new CouponLifecycleService(
            couponStore, campaignStore, fixtures.rulesEngine, fixtures.clock);

        campaign = campaignStore.save(CouponFixtures.activeCampaign(null));
        coupon = couponStore.save(fixtures.signedCoupon(campaign, "LIFECYCLE1"));
    }

    @Test
    void testDeactivateThenActivateKeepsUsage() {
        coupon.setCurrentUses(2);
        coupon.setMaxUses(5);
        couponStore.save(coupon);

        assertEquals(CouponStatus.INACTIVE, lifecycleService.deactivate(coupon.getId()).getStatus());
        Coupon reactivated = lifecycleService.activate(coupon.getId());

        assertEquals(CouponStatus.ACTIVE, reactivated.getStatus());
        assertEquals(2, reactivated.getCurrentUses());
    }

    @Test
    void testTransitionToCurrentStatusIsNoOp() {
        assertEquals(CouponStatus.ACTIVE, lifecycleService.activate(coupon.getId()).getStatus());
    }

    @Test
    void testActivatingCancelledCouponFails() {
        lifecycleService.cancel(coupon.getId(), "reported stolen");

        assertThrows(InvalidCouponStateException.class, () -> lifecycleService.activate(coupon.getId()));
        assertThrows(InvalidCouponStateException.class, () -> lifecycleService.deactivate(coupon.getId()));
        assertEquals(CouponStatus.CANCELLED, couponStore.findById(coupon.getId()).orElseThrow().getStatus());
    }

    @Test
    void testTerminalStatusesCannotBeLeft() {
        coupon.setStatus(CouponStatus.EXPIRED);
        couponStore.save(coupon);

        assertThrows(InvalidCouponStateException.class, () -> lifecycleService.activate(coupon.getId()));
        assertThrows(InvalidCouponStateException.class, () -> lifecycleService.cancel(coupon.getId(), "cleanup"));
    }

    @Test
    void testCancelFromInactive() {
        lifecycleService.deactivate(coupon.getId());

        assertEquals(CouponStatus.CANCELLED, lifecycleService.cancel(coupon.getId(), "campaign withdrawn").getStatus());
    }

    @Test
    void testUnknownCoupon() {
        assertThrows(CouponNotFoundException.class, () -> lifecycleService.activate(999L));
        assertThrows(CouponNotFoundException.class, () -> lifecycleService.consumeUse(999L));
    }

    @Test
    void testConsumeUseIncrementsByOne() {
        coupon.setMaxUses(3);
        couponStore.save(coupon);

        Coupon consumed = lifecycleService.consumeUse(coupon.getId());

        assertEquals(1, consumed.getCurrentUses());
        assertEquals(CouponStatus.ACTIVE, consumed.getStatus());
        assertEquals(1, campaign.getUsedCoupons());
    }

    @Test
    void testLastUseMovesCouponToUsedUp() {
        coupon.setMaxUses(2);
        couponStore.save(coupon);

        lifecycleService.consumeUse(coupon.getId());
        Coupon last = lifecycleService.consumeUse(coupon.getId());

        assertEquals(2, last.getCurrentUses());
        assertEquals(CouponStatus.USED_UP, last.getStatus());

        CouponNotUsableException error = assertThrows(CouponNotUsableException.class,
            () -> lifecycleService.consumeUse(coupon.getId()));
        assertTrue(error.getViolations().stream()
            .anyMatch(v -> v.getType() == ViolationType.USAGE_LIMIT_REACHED));
        assertEquals(2, couponStore.findById(coupon.getId()).orElseThrow().getCurrentUses());
    }

    @Test
    void testUnlimitedCouponStaysActive() {
        for (int i = 0; i < 5; i++) {
            lifecycleService.consumeUse(coupon.getId());
        }

        Coupon stored = couponStore.findById(coupon.getId()).orElseThrow();
        assertEquals(5, stored.getCurrentUses());
        assertEquals(CouponStatus.ACTIVE, stored.getStatus());
    }

    @Test
    void testConsumeRechecksStatusAndWindow() {
        lifecycleService.deactivate(coupon.getId());
        CouponNotUsableException inactive = assertThrows(CouponNotUsableException.class,
            () -> lifecycleService.consumeUse(coupon.getId()));
        assertEquals(ViolationType.STATUS_NOT_ACTIVE, inactive.getViolations().get(0).getType());

        lifecycleService.activate(coupon.getId());
        Coupon stored = couponStore.findById(coupon.getId()).orElseThrow();
        stored.setValidUntil(CouponFixtures.NOW.minus(1, ChronoUnit.MINUTES));
        couponStore.save(stored);
        CouponNotUsableException expired = assertThrows(CouponNotUsableException.class,
            () -> lifecycleService.consumeUse(coupon.getId()));
        assertEquals(ViolationType.EXPIRED, expired.getViolations().get(0).getType());
    }

    @Test
    void testConcurrentConsumeOfLastUse() throws Exception {
        coupon.setMaxUses(1);
        couponStore.save(coupon);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        lifecycleService.consumeUse(coupon.getId());
                        return true;
                    } catch (CouponNotUsableException | CouponConflictException e) {
                        return false;
                    }
                };
                results.add(executor.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    successes++;
                }
            }
            assertEquals(1, successes);
        } finally {
            executor.shutdownNow();
        }

        Coupon stored = couponStore.findById(coupon.getId()).orElseThrow();
        assertEquals(1, stored.getCurrentUses());
        assertEquals(CouponStatus.USED_UP, stored.getStatus());
        assertEquals(1, campaign.getUsedCoupons());
    }

    @Test
    void testConcurrentConsumeNeverOverruns() throws Exception {
        coupon.setMaxUses(5);
        couponStore.save(coupon);

        int threads = 12;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        lifecycleService.consumeUse(coupon.getId());
                        return true;
                    } catch (CouponNotUsableException | CouponConflictException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            for (Future<Boolean> result : results) {
                result.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Coupon stored = couponStore.findById(coupon.getId()).orElseThrow();
        assertTrue(stored.getCurrentUses() <= 5);
        assertEquals(stored.getCurrentUses(), campaign.getUsedCoupons());
        if (stored.getCurrentUses() == 5) {
            assertEquals(CouponStatus.USED_UP, stored.getStatus());
        }
    }

    @Test
    void testLostCompareAndSetIsAConflict() {
        InMemoryCouponStore contendedStore = new InMemoryCouponStore() {
            @Override
            public boolean compareAndIncrementUsage(Long couponId, int expectedUses, CouponStatus resultingStatus) {
                return false;
            }

            @Override
            public boolean compareAndSetStatus(Long couponId, CouponStatus expected, CouponStatus target) {
                return false;
            }
        };
        Coupon stored = contendedStore.save(fixtures.signedCoupon(campaign, "CONTENDED1"));
        CouponLifecycleService contended = new CouponLifecycleService(
            contendedStore, campaignStore, fixtures.rulesEngine, fixtures.clock);

        assertThrows(CouponConflictException.class, () -> contended.consumeUse(stored.getId()));
        assertThrows(CouponConflictException.class, () -> contended.deactivate(stored.getId()));
        assertEquals(0, contendedStore.findById(stored.getId()).orElseThrow().getCurrentUses());
        assertEquals(0, campaign.getUsedCoupons());
    }

    @Test
    void testExpireOverdue() {
        Coupon overdue = fixtures.signedCoupon(campaign, "OVERDUE001");
        overdue.setValidUntil(CouponFixtures.NOW.minus(1, ChronoUnit.DAYS));
        couponStore.save(overdue);

        Coupon overdueInactive = fixtures.signedCoupon(campaign, "OVERDUE002");
        overdueInactive.setValidUntil(CouponFixtures.NOW.minus(1, ChronoUnit.DAYS));
        overdueInactive.setStatus(CouponStatus.INACTIVE);
        couponStore.save(overdueInactive);

        Coupon overdueCancelled = fixtures.signedCoupon(campaign, "OVERDUE003");
        overdueCancelled.setValidUntil(CouponFixtures.NOW.minus(1, ChronoUnit.DAYS));
        overdueCancelled.setStatus(CouponStatus.CANCELLED);
        couponStore.save(overdueCancelled);

        assertEquals(2, lifecycleService.expireOverdue());
        assertEquals(CouponStatus.EXPIRED, couponStore.findById(overdue.getId()).orElseThrow().getStatus());
        assertEquals(CouponStatus.EXPIRED, couponStore.findById(overdueInactive.getId()).orElseThrow().getStatus());
        assertEquals(CouponStatus.CANCELLED, couponStore.findById(overdueCancelled.getId()).orElseThrow().getStatus());
        assertEquals(CouponStatus.ACTIVE, couponStore.findById(coupon.getId()).orElseThrow().getStatus());
        assertEquals(0, lifecycleService.expireOverdue());
    }
}
