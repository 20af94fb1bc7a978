package com.couponengine.audit;

/**
 * Structural problems the auditor can find on a stored coupon.
 */
public enum IntegrityIssue {
    INVALID_TOKEN_FORMAT("Invalid QR token format"),
    INVALID_SIGNATURE("Invalid QR token signature"),
    INVERTED_DATE_RANGE("Valid from date is after valid until date"),
    USAGE_OVERRUN("Current uses exceed maximum uses"),
    CONFLICTING_DISCOUNT_TYPES("Both discount amount and percentage are set"),
    STATUS_USAGE_MISMATCH("Status USED_UP does not match the usage counters");

    private final String description;

    IntegrityIssue(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
