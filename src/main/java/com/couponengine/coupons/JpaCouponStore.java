package com.couponengine.coupons;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * {@link CouponStore} backed by Spring Data JPA.
 *
 * Compare-and-set operations are single conditional UPDATE statements, so the database
 * row lock decides which of two racing writers wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaCouponStore implements CouponStore {

    private final CouponRepository couponRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Coupon> findById(Long couponId) {
        return couponRepository.findById(couponId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Coupon> findByToken(String token) {
        return couponRepository.findByToken(token);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Coupon> findByCouponCode(String couponCode) {
        return couponRepository.findByCouponCode(couponCode);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByCouponCode(String couponCode) {
        return couponRepository.existsByCouponCode(couponCode);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Coupon> findAll() {
        return couponRepository.findAll();
    }

    @Override
    @Transactional
    public Coupon save(Coupon coupon) {
        coupon.setUpdatedAt(Instant.now(clock));
        return couponRepository.save(coupon);
    }

    @Override
    @Transactional
    public boolean compareAndSetStatus(Long couponId, CouponStatus expected, CouponStatus target) {
        int updated = couponRepository.updateStatusIfCurrent(couponId, expected, target, Instant.now(clock));
        log.debug("Status CAS on coupon {} {} -> {}: {}", couponId, expected, target, updated == 1);
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean compareAndIncrementUsage(Long couponId, int expectedUses, CouponStatus resultingStatus) {
        int updated = couponRepository.incrementUsageIfCurrent(
            couponId, expectedUses, CouponStatus.ACTIVE, resultingStatus, Instant.now(clock));
        log.debug("Usage CAS on coupon {} from {} uses: {}", couponId, expectedUses, updated == 1);
        return updated == 1;
    }

    @Override
    @Transactional
    public int markExpired(Instant now) {
        return couponRepository.markExpired(now, CouponStatus.EXPIRED,
            EnumSet.of(CouponStatus.ACTIVE, CouponStatus.INACTIVE));
    }
}
