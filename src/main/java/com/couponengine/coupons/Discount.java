package com.couponengine.coupons;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Discount terms of a coupon: a fixed amount, a percentage, or nothing.
 *
 * Storage keeps two nullable columns; this value is the only way the engine reads or
 * writes them, so a coupon built through it can never carry both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Discount {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
    private static final Discount NONE = new Discount(DiscountType.NONE, null);

    DiscountType type;
    BigDecimal value;

    public static Discount none() {
        return NONE;
    }

    public static Discount fixedAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Fixed discount amount must be positive: " + amount);
        }
        return new Discount(DiscountType.FIXED_AMOUNT, amount.setScale(2, RoundingMode.HALF_UP));
    }

    public static Discount percentage(BigDecimal percentage) {
        if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(ONE_HUNDRED) > 0) {
            throw new IllegalArgumentException("Discount percentage must be in (0, 100]: " + percentage);
        }
        return new Discount(DiscountType.PERCENTAGE, percentage);
    }

    /**
     * Rebuild from stored columns. Legacy rows with both columns set resolve to the fixed
     * amount; the integrity auditor reports them separately.
     */
    public static Discount fromColumns(BigDecimal fixedAmount, BigDecimal percentage) {
        if (fixedAmount != null) {
            return new Discount(DiscountType.FIXED_AMOUNT, fixedAmount);
        }
        if (percentage != null) {
            return new Discount(DiscountType.PERCENTAGE, percentage);
        }
        return NONE;
    }

    public BigDecimal getFixedAmount() {
        return type == DiscountType.FIXED_AMOUNT ? value : null;
    }

    public BigDecimal getPercentage() {
        return type == DiscountType.PERCENTAGE ? value : null;
    }

    public boolean providesDiscount() {
        return type != DiscountType.NONE;
    }

    /**
     * Amount taken off a purchase. A fixed discount never exceeds the purchase itself.
     */
    public BigDecimal calculate(BigDecimal purchaseAmount) {
        if (purchaseAmount == null || purchaseAmount.signum() <= 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        switch (type) {
            case FIXED_AMOUNT:
                return value.min(purchaseAmount).setScale(2, RoundingMode.HALF_UP);
            case PERCENTAGE:
                return purchaseAmount.multiply(value)
                    .divide(ONE_HUNDRED, 2, RoundingMode.HALF_UP);
            default:
                return BigDecimal.ZERO.setScale(2);
        }
    }
}
