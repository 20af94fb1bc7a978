package com.couponengine.common.exception;

import com.couponengine.rules.Violation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a coupon cannot be consumed because it is not currently usable.
 *
 * This is an expected, reportable outcome. Callers must re-validate before retrying.
 */
public class CouponNotUsableException extends CouponEngineException {

    private final Long couponId;
    private final List<Violation> violations;

    public CouponNotUsableException(Long couponId, List<Violation> violations) {
        super(String.format("Coupon %s cannot be used: %s", couponId,
            violations.stream().map(Violation::getMessage).collect(Collectors.joining("; "))));
        this.couponId = couponId;
        this.violations = List.copyOf(violations);
    }

    public Long getCouponId() {
        return couponId;
    }

    public List<Violation> getViolations() {
        return violations;
    }
}
