package com.couponengine.rules;

import lombok.Value;

/**
 * One reason a coupon failed validation.
 */
@Value
public class Violation {
    ViolationType type;
    String message;

    public static Violation of(ViolationType type, String message) {
        return new Violation(type, message);
    }
}
