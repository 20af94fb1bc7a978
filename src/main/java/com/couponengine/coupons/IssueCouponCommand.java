package com.couponengine.coupons;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Request to issue one coupon into a campaign.
 *
 * Unset discount terms and raffle tickets fall back to the campaign defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueCouponCommand {

    @NotNull(message = "Campaign ID is required")
    private Long campaignId;

    /**
     * Generated when absent.
     */
    @Pattern(regexp = "[A-Z0-9]{6,50}", message = "Coupon code must be 6-50 characters of A-Z and 0-9")
    private String couponCode;

    /**
     * Defaults to the issuance time.
     */
    private Instant validFrom;

    /**
     * Defaults to the campaign end.
     */
    private Instant validUntil;

    @Positive(message = "Discount amount must be positive")
    private BigDecimal discountAmount;

    @DecimalMin(value = "0", inclusive = false, message = "Discount percentage must be above 0")
    @DecimalMax(value = "100", message = "Discount percentage cannot exceed 100")
    private BigDecimal discountPercentage;

    @Positive(message = "Minimum purchase amount must be positive")
    private BigDecimal minimumPurchaseAmount;

    @Builder.Default
    private Set<String> applicableFuelTypes = new HashSet<>();

    @Builder.Default
    private Set<Long> applicableStations = new HashSet<>();

    @Min(value = 1, message = "Max uses must be at least 1")
    private Integer maxUses;

    @Min(value = 0, message = "Raffle tickets cannot be negative")
    private Integer raffleTickets;

    @AssertTrue(message = "Only one of discount amount and discount percentage may be set")
    public boolean isSingleDiscountKind() {
        return discountAmount == null || discountPercentage == null;
    }

    @AssertTrue(message = "Valid from must not be after valid until")
    public boolean isValidityWindowOrdered() {
        return validFrom == null || validUntil == null || !validFrom.isAfter(validUntil);
    }
}
