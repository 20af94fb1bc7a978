package com.couponengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Coupon Engine.
 *
 * Coupon Engine issues discount and raffle coupons as signed QR tokens and decides,
 * at redemption time, whether a presented token is authentic, unmodified, currently
 * usable and applicable to the station, fuel type and purchase at hand.
 */
@SpringBootApplication
public class CouponEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CouponEngineApplication.class, args);
    }
}
