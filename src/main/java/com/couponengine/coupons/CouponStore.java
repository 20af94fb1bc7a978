package com.couponengine.coupons;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Coupon collaborator contract.
 *
 * The compare-and-set operations must be atomic at the shared storage boundary, not in
 * process: several service instances may race on the same coupon. An implementation
 * applies each one as a single conditional write and reports whether it took effect.
 */
public interface CouponStore {

    Optional<Coupon> findById(Long couponId);

    Optional<Coupon> findByToken(String token);

    Optional<Coupon> findByCouponCode(String couponCode);

    boolean existsByCouponCode(String couponCode);

    List<Coupon> findAll();

    Coupon save(Coupon coupon);

    /**
     * Set the status to {@code target} only if it is still {@code expected}.
     *
     * @return true if the status was changed
     */
    boolean compareAndSetStatus(Long couponId, CouponStatus expected, CouponStatus target);

    /**
     * Add one use only if the coupon is still ACTIVE, still has exactly
     * {@code expectedUses} uses and is below its limit. The status is set to
     * {@code resultingStatus} in the same write.
     *
     * @return true if the use was recorded
     */
    boolean compareAndIncrementUsage(Long couponId, int expectedUses, CouponStatus resultingStatus);

    /**
     * Move every ACTIVE or INACTIVE coupon whose validity ended before {@code now} to EXPIRED.
     *
     * @return number of coupons expired
     */
    int markExpired(Instant now);
}
