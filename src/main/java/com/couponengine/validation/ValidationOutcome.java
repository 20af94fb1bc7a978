package com.couponengine.validation;

import com.couponengine.coupons.Coupon;
import com.couponengine.rules.Violation;
import com.couponengine.rules.ViolationType;
import lombok.Value;

import java.util.List;

/**
 * Result of validating one coupon for redemption.
 *
 * A lookup miss is its own variant ({@code found == false}) carrying a single NOT_FOUND
 * violation; in every other case the violations are the rule results in pipeline order.
 */
@Value
public class ValidationOutcome {

    boolean found;
    boolean valid;
    /**
     * Valid and the coupon still has capacity left.
     */
    boolean canBeUsed;
    Coupon coupon;
    List<Violation> violations;

    public static ValidationOutcome notFound() {
        return new ValidationOutcome(false, false, false, null,
            List.of(Violation.of(ViolationType.NOT_FOUND, "Coupon not found")));
    }

    public static ValidationOutcome of(Coupon coupon, List<Violation> violations) {
        boolean valid = violations.isEmpty();
        return new ValidationOutcome(true, valid, valid && coupon.hasRemainingCapacity(),
            coupon, List.copyOf(violations));
    }

    public boolean hasViolation(ViolationType type) {
        return violations.stream().anyMatch(violation -> violation.getType() == type);
    }

    public List<String> getMessages() {
        return violations.stream().map(Violation::getMessage).toList();
    }
}
