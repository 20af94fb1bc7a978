package com.couponengine.coupons;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for discount terms.
 */
class DiscountTest {

    @Test
    void testFixedAmountIsCappedAtPurchase() {
        Discount discount = Discount.fixedAmount(new BigDecimal("10"));

        assertEquals(new BigDecimal("10.00"), discount.calculate(new BigDecimal("45.50")));
        assertEquals(new BigDecimal("7.25"), discount.calculate(new BigDecimal("7.25")));
    }

    @Test
    void testPercentageRoundsHalfUp() {
        Discount discount = Discount.percentage(new BigDecimal("15"));

        assertEquals(new BigDecimal("6.83"), discount.calculate(new BigDecimal("45.50")));
    }

    @Test
    void testNoneAndMissingPurchaseGiveZero() {
        assertEquals(new BigDecimal("0.00"), Discount.none().calculate(new BigDecimal("45.50")));
        assertEquals(new BigDecimal("0.00"), Discount.percentage(BigDecimal.TEN).calculate(null));
        assertFalse(Discount.none().providesDiscount());
    }

    @Test
    void testInvalidTermsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Discount.fixedAmount(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> Discount.percentage(new BigDecimal("100.01")));
        assertThrows(IllegalArgumentException.class, () -> Discount.percentage(null));
    }

    @Test
    void testColumnsWriteExactlyOneKind() {
        Coupon coupon = new Coupon();
        coupon.applyDiscount(Discount.fixedAmount(new BigDecimal("5")));
        coupon.applyDiscount(Discount.percentage(new BigDecimal("20")));

        assertNull(coupon.getDiscountAmount());
        assertEquals(new BigDecimal("20"), coupon.getDiscountPercentage());
        assertEquals(DiscountType.PERCENTAGE, coupon.getDiscount().getType());
    }

    @Test
    void testLegacyRowWithBothColumnsResolvesToFixed() {
        Discount discount = Discount.fromColumns(new BigDecimal("5.00"), new BigDecimal("20"));

        assertEquals(DiscountType.FIXED_AMOUNT, discount.getType());
        assertNull(discount.getPercentage());
    }
}
