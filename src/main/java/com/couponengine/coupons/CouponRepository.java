package com.couponengine.coupons;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Repository for coupon persistence.
 */
@Repository
public interface CouponRepository extends JpaRepository<Coupon, Long> {

    Optional<Coupon> findByToken(String token);

    Optional<Coupon> findByCouponCode(String couponCode);

    boolean existsByCouponCode(String couponCode);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Coupon c set c.status = :target, c.updatedAt = :at "
        + "where c.id = :id and c.status = :expected")
    int updateStatusIfCurrent(@Param("id") Long id,
                              @Param("expected") CouponStatus expected,
                              @Param("target") CouponStatus target,
                              @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Coupon c set c.currentUses = c.currentUses + 1, c.status = :resultingStatus, "
        + "c.updatedAt = :at "
        + "where c.id = :id and c.status = :active and c.currentUses = :expectedUses "
        + "and (c.maxUses is null or c.currentUses < c.maxUses)")
    int incrementUsageIfCurrent(@Param("id") Long id,
                                @Param("expectedUses") int expectedUses,
                                @Param("active") CouponStatus active,
                                @Param("resultingStatus") CouponStatus resultingStatus,
                                @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Coupon c set c.status = :expired, c.updatedAt = :now "
        + "where c.validUntil < :now and c.status in :fromStatuses")
    int markExpired(@Param("now") Instant now,
                    @Param("expired") CouponStatus expired,
                    @Param("fromStatuses") Collection<CouponStatus> fromStatuses);
}
