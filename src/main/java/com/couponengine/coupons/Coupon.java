package com.couponengine.coupons;

import com.couponengine.campaigns.Campaign;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Coupon issued under a campaign and presented as a signed QR token.
 *
 * The token, its signature, the coupon code, the campaign and the issuance time are
 * fixed at issuance and covered by the signature. Status and current uses change only
 * through {@link CouponLifecycleService}.
 */
@Entity
@Table(name = "coupons", indexes = {
    @Index(name = "idx_coupon_campaign_id", columnList = "campaign_id"),
    @Index(name = "idx_coupon_status_valid_until", columnList = "status, valid_until")
})
@Data
@NoArgsConstructor
public class Coupon {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "campaign_id", nullable = false, updatable = false)
    private Campaign campaign;

    /**
     * QR-encoded token string.
     */
    @Column(nullable = false, unique = true, updatable = false, length = 120)
    private String token;

    /**
     * Detached signature over the token and the immutable issuance fields.
     */
    @Column(name = "token_signature", updatable = false, length = 512)
    private String tokenSignature;

    @Column(name = "coupon_code", nullable = false, unique = true, updatable = false, length = 50)
    private String couponCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CouponStatus status;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @Column(name = "valid_from", nullable = false)
    private Instant validFrom;

    @Column(name = "valid_until", nullable = false)
    private Instant validUntil;

    @Column(name = "discount_amount", precision = 10, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "discount_percentage", precision = 5, scale = 2)
    private BigDecimal discountPercentage;

    @Column(name = "minimum_purchase_amount", precision = 10, scale = 2)
    private BigDecimal minimumPurchaseAmount;

    /**
     * Fuel types this coupon applies to. Empty means all.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "coupon_fuel_types", joinColumns = @JoinColumn(name = "coupon_id"))
    @Column(name = "fuel_type")
    private Set<String> applicableFuelTypes = new HashSet<>();

    /**
     * Station ids this coupon applies to. Empty means all.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "coupon_stations", joinColumns = @JoinColumn(name = "coupon_id"))
    @Column(name = "station_id")
    private Set<Long> applicableStations = new HashSet<>();

    /**
     * Null means unlimited.
     */
    @Column(name = "max_uses")
    private Integer maxUses;

    @Column(name = "current_uses", nullable = false)
    private int currentUses;

    @Column(name = "raffle_tickets", nullable = false)
    private int raffleTickets;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Coupon(Campaign campaign, String couponCode, String token, String tokenSignature,
                  Instant issuedAt, Instant validFrom, Instant validUntil) {
        this.campaign = campaign;
        this.couponCode = couponCode;
        this.token = token;
        this.tokenSignature = tokenSignature;
        this.issuedAt = issuedAt;
        this.validFrom = validFrom;
        this.validUntil = validUntil;
        this.status = CouponStatus.ACTIVE;
        this.currentUses = 0;
        this.createdAt = issuedAt;
        this.updatedAt = issuedAt;
    }

    public Long getCampaignId() {
        return campaign != null ? campaign.getId() : null;
    }

    public Discount getDiscount() {
        return Discount.fromColumns(discountAmount, discountPercentage);
    }

    public void applyDiscount(Discount discount) {
        this.discountAmount = discount.getFixedAmount();
        this.discountPercentage = discount.getPercentage();
    }

    public boolean isActive() {
        return status == CouponStatus.ACTIVE;
    }

    public boolean isExpiredAt(Instant instant) {
        return instant.isAfter(validUntil);
    }

    public boolean isNotYetValidAt(Instant instant) {
        return instant.isBefore(validFrom);
    }

    public boolean hasRemainingCapacity() {
        return maxUses == null || currentUses < maxUses;
    }

    /**
     * Remaining uses, or null when the coupon is unlimited.
     */
    public Integer getRemainingUses() {
        return maxUses == null ? null : Math.max(0, maxUses - currentUses);
    }

    public double getUsagePercentage() {
        if (maxUses == null || maxUses == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(currentUses * 100L)
            .divide(BigDecimal.valueOf(maxUses), 2, RoundingMode.HALF_UP)
            .doubleValue();
    }

    /**
     * Status the coupon must carry once one more use has been recorded.
     */
    public CouponStatus statusAfterOneMoreUse() {
        if (maxUses != null && currentUses + 1 >= maxUses) {
            return CouponStatus.USED_UP;
        }
        return status;
    }

    public boolean appliesToStation(Long stationId) {
        return applicableStations.isEmpty() || applicableStations.contains(stationId);
    }

    public boolean appliesToFuelType(String fuelType) {
        return applicableFuelTypes.isEmpty()
            || applicableFuelTypes.stream().anyMatch(type -> type.equalsIgnoreCase(fuelType.trim()));
    }

    public boolean meetsMinimumPurchase(BigDecimal purchaseAmount) {
        return minimumPurchaseAmount == null || purchaseAmount.compareTo(minimumPurchaseAmount) >= 0;
    }

    /**
     * Human-readable summary of what the coupon grants.
     */
    public String describeDiscount() {
        Discount discount = getDiscount();
        switch (discount.getType()) {
            case FIXED_AMOUNT:
                return "Fixed discount: " + discount.getValue().setScale(2, RoundingMode.HALF_UP).toPlainString();
            case PERCENTAGE:
                return "Percentage discount: " + discount.getValue().stripTrailingZeros().toPlainString() + "%";
            default:
                if (raffleTickets > 0) {
                    return "Raffle tickets only: " + raffleTickets + " tickets";
                }
                return "No discount information available";
        }
    }
}
