package com.couponengine.campaigns;

import com.couponengine.coupons.Discount;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Campaign under which coupons are issued.
 *
 * Owned by campaign administration. The engine reads it and only touches the
 * generated/used counters.
 */
@Entity
@Table(name = "campaigns", indexes = {
    @Index(name = "idx_campaign_status", columnList = "status")
})
@Data
@NoArgsConstructor
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String name;

    @Enumerated(EnumType.STRING)
    private CampaignStatus status;

    @Column(name = "starts_at")
    private Instant startsAt;

    @Column(name = "ends_at")
    private Instant endsAt;

    /**
     * Default discount terms applied to coupons issued without explicit terms.
     * At most one of the two is set.
     */
    @Column(name = "default_discount_amount", precision = 10, scale = 2)
    private BigDecimal defaultDiscountAmount;

    @Column(name = "default_discount_percentage", precision = 5, scale = 2)
    private BigDecimal defaultDiscountPercentage;

    @Column(name = "default_raffle_tickets")
    private int defaultRaffleTickets;

    /**
     * Capacity; null means unlimited.
     */
    @Column(name = "max_coupons")
    private Integer maxCoupons;

    @Column(name = "generated_coupons")
    private int generatedCoupons;

    @Column(name = "used_coupons")
    private int usedCoupons;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Campaign(String name, CampaignStatus status, Instant startsAt, Instant endsAt,
                    Discount defaultDiscount, int defaultRaffleTickets, Integer maxCoupons) {
        this.name = name;
        this.status = status;
        this.startsAt = startsAt;
        this.endsAt = endsAt;
        this.defaultDiscountAmount = defaultDiscount.getFixedAmount();
        this.defaultDiscountPercentage = defaultDiscount.getPercentage();
        this.defaultRaffleTickets = defaultRaffleTickets;
        this.maxCoupons = maxCoupons;
    }

    public boolean isActive() {
        return status == CampaignStatus.ACTIVE;
    }

    public boolean hasReachedCapacity() {
        return maxCoupons != null && generatedCoupons >= maxCoupons;
    }

    /**
     * Coupons that can still be issued; null when the campaign is unlimited.
     */
    public Integer getRemainingCapacity() {
        return maxCoupons == null ? null : Math.max(0, maxCoupons - generatedCoupons);
    }

    public Discount getDefaultDiscount() {
        return Discount.fromColumns(defaultDiscountAmount, defaultDiscountPercentage);
    }
}
