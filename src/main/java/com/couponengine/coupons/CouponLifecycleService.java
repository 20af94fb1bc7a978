package com.couponengine.coupons;

import com.couponengine.campaigns.CampaignStore;
import com.couponengine.common.exception.CouponConflictException;
import com.couponengine.common.exception.CouponNotFoundException;
import com.couponengine.common.exception.CouponNotUsableException;
import com.couponengine.common.exception.InvalidCouponStateException;
import com.couponengine.rules.RedemptionContext;
import com.couponengine.rules.RulesEngine;
import com.couponengine.rules.Violation;
import com.couponengine.rules.ViolationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Coupon status machine and the single mutator of {@code currentUses}.
 *
 * Every write goes through a compare-and-set on the store, so two instances racing on the
 * same coupon cannot both win. A lost CAS surfaces as {@link CouponConflictException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CouponLifecycleService {

    private final CouponStore couponStore;
    private final CampaignStore campaignStore;
    private final RulesEngine rulesEngine;
    private final Clock clock;

    @Transactional
    public Coupon activate(Long couponId) {
        Coupon coupon = transition(couponId, CouponStatus.ACTIVE, "activate");
        log.info("Activated coupon {}", couponId);
        return coupon;
    }

    @Transactional
    public Coupon deactivate(Long couponId) {
        Coupon coupon = transition(couponId, CouponStatus.INACTIVE, "deactivate");
        log.info("Deactivated coupon {}", couponId);
        return coupon;
    }

    @Transactional
    public Coupon cancel(Long couponId, String reason) {
        Coupon coupon = transition(couponId, CouponStatus.CANCELLED, "cancel");
        log.info("Cancelled coupon {}: {}", couponId, reason);
        return coupon;
    }

    /**
     * Record one use of the coupon.
     *
     * The coupon is re-read and its status, validity window and usage limit re-checked
     * here, whatever an earlier validation said. Reaching {@code maxUses} moves the coupon
     * to USED_UP in the same write. A lost compare-and-set is retried in a fresh transaction
     * with a jittered backoff.
     *
     * @return the coupon after the use was recorded
     * @throws CouponNotUsableException if the coupon is not usable right now, or with
     *                                  CONCURRENT_UPDATE once every attempt lost a race
     */
    @Transactional
    @Retryable(
        retryFor = CouponConflictException.class,
        notRecoverable = {CouponNotUsableException.class, CouponNotFoundException.class},
        maxAttemptsExpression = "${coupon-engine.consumption.max-attempts:3}",
        backoff = @Backoff(
            delayExpression = "${coupon-engine.consumption.backoff-delay-ms:20}",
            multiplier = 2,
            maxDelay = 500,
            random = true
        ),
        recover = "consumeUseContended"
    )
    public Coupon consumeUse(Long couponId) {
        Coupon coupon = load(couponId);
        List<Violation> violations = rulesEngine.evaluateConsumptionRules(
            RedemptionContext.forConsumption(coupon, Instant.now(clock)));
        if (!violations.isEmpty()) {
            log.info("Coupon {} not usable at consumption: {}", couponId,
                violations.stream().map(Violation::getType).toList());
            throw new CouponNotUsableException(couponId, violations);
        }

        CouponStatus resultingStatus = coupon.statusAfterOneMoreUse();
        if (!couponStore.compareAndIncrementUsage(couponId, coupon.getCurrentUses(), resultingStatus)) {
            log.warn("Concurrent update on coupon {} at {} use(s)", couponId, coupon.getCurrentUses());
            throw new CouponConflictException(couponId, "consumeUse");
        }

        campaignStore.incrementUsedCoupons(coupon.getCampaignId());
        Coupon updated = load(couponId);
        log.info("Consumed use {}{} of coupon {}{}", updated.getCurrentUses(),
            updated.getMaxUses() != null ? "/" + updated.getMaxUses() : "",
            couponId, resultingStatus == CouponStatus.USED_UP ? ", now USED_UP" : "");
        return updated;
    }

    /**
     * Every consumption attempt lost its compare-and-set. The coupon may still have
     * capacity, so this is reported apart from USAGE_LIMIT_REACHED.
     */
    @Recover
    public Coupon consumeUseContended(CouponConflictException exception, Long couponId) {
        log.error("Gave up consuming coupon {} after repeated concurrent updates", couponId);
        throw new CouponNotUsableException(couponId, List.of(Violation.of(
            ViolationType.CONCURRENT_UPDATE,
            "Coupon is being redeemed concurrently; re-validate before retrying")));
    }

    /**
     * Expire every ACTIVE or INACTIVE coupon whose validity window has ended.
     *
     * @return number of coupons moved to EXPIRED
     */
    @Transactional
    public int expireOverdue() {
        int expired = couponStore.markExpired(Instant.now(clock));
        if (expired > 0) {
            log.info("Expired {} overdue coupon(s)", expired);
        }
        return expired;
    }

    private Coupon transition(Long couponId, CouponStatus target, String operation) {
        Coupon coupon = load(couponId);
        CouponStatus current = coupon.getStatus();
        if (current == target) {
            return coupon;
        }
        if (!current.canChangeTo(target)) {
            throw new InvalidCouponStateException(couponId, current.name(), operation);
        }
        if (!couponStore.compareAndSetStatus(couponId, current, target)) {
            log.warn("Status of coupon {} changed from {} during {}", couponId, current, operation);
            throw new CouponConflictException(couponId, operation);
        }
        return load(couponId);
    }

    private Coupon load(Long couponId) {
        return couponStore.findById(couponId)
            .orElseThrow(() -> new CouponNotFoundException(couponId));
    }
}
