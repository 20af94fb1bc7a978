package com.couponengine.rules;

import lombok.Value;

/**
 * Result of a rule evaluation: a pass, or exactly one violation.
 */
@Value
public class RuleResult {
    boolean passed;
    Violation violation;

    public static RuleResult pass() {
        return new RuleResult(true, null);
    }

    public static RuleResult fail(ViolationType type, String message) {
        return new RuleResult(false, Violation.of(type, message));
    }
}
