package com.couponengine.coupons;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the coupon status machine.
 */
class CouponStatusTest {

    @Test
    void testTerminalStatusesHaveNoExit() {
        for (CouponStatus terminal : new CouponStatus[]{CouponStatus.EXPIRED, CouponStatus.USED_UP, CouponStatus.CANCELLED}) {
            assertTrue(terminal.isTerminal());
            for (CouponStatus target : CouponStatus.values()) {
                assertFalse(terminal.canChangeTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    void testActiveInactiveToggle() {
        assertTrue(CouponStatus.ACTIVE.canChangeTo(CouponStatus.INACTIVE));
        assertTrue(CouponStatus.INACTIVE.canChangeTo(CouponStatus.ACTIVE));
        assertTrue(CouponStatus.INACTIVE.canChangeTo(CouponStatus.CANCELLED));
        assertFalse(CouponStatus.INACTIVE.canChangeTo(CouponStatus.USED_UP));
    }

    @Test
    void testOnlyActiveAllowsUsage() {
        for (CouponStatus status : CouponStatus.values()) {
            assertEquals(status == CouponStatus.ACTIVE, status.allowsUsage());
        }
    }

    @Test
    void testStatusAfterOneMoreUse() {
        Coupon coupon = new Coupon();
        coupon.setStatus(CouponStatus.ACTIVE);

        assertEquals(CouponStatus.ACTIVE, coupon.statusAfterOneMoreUse());

        coupon.setMaxUses(3);
        coupon.setCurrentUses(1);
        assertEquals(CouponStatus.ACTIVE, coupon.statusAfterOneMoreUse());

        coupon.setCurrentUses(2);
        assertEquals(CouponStatus.USED_UP, coupon.statusAfterOneMoreUse());
    }
}
