package com.couponengine.audit;

import lombok.Value;

import java.util.List;

/**
 * Audit result for one coupon. Informational only.
 */
@Value
public class IntegrityReport {
    Long couponId;
    String couponCode;
    List<IntegrityIssue> issues;

    public boolean isIntact() {
        return issues.isEmpty();
    }

    public boolean hasIssue(IntegrityIssue issue) {
        return issues.contains(issue);
    }
}
