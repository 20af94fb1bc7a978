package com.couponengine.campaigns;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Repository for campaign persistence.
 */
@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Campaign c set c.generatedCoupons = c.generatedCoupons + 1, c.updatedAt = :at "
        + "where c.id = :id and (c.maxCoupons is null or c.generatedCoupons < c.maxCoupons)")
    int incrementGeneratedCoupons(@Param("id") Long id, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Campaign c set c.generatedCoupons = c.generatedCoupons + :count, c.updatedAt = :at "
        + "where c.id = :id and (c.maxCoupons is null or c.generatedCoupons + :count <= c.maxCoupons)")
    int reserveGeneratedCoupons(@Param("id") Long id, @Param("count") int count, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Campaign c set c.usedCoupons = c.usedCoupons + 1, c.updatedAt = :at "
        + "where c.id = :id")
    int incrementUsedCoupons(@Param("id") Long id, @Param("at") Instant at);
}
