package com.couponengine.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Enables {@code @Retryable} and {@code @Recover} on service beans.
 *
 * The retry advice runs outside the transaction advice, so each attempt gets its own transaction.
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
