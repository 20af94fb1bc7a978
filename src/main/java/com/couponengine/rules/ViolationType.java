package com.couponengine.rules;

/**
 * Kinds of reasons a coupon cannot be redeemed. Each kind is reported separately so
 * operators can tell corruption, forgery and replay apart.
 */
public enum ViolationType {
    NOT_FOUND,
    MALFORMED_TOKEN,
    SIGNATURE_INVALID,
    TOKEN_STALE,
    STATUS_NOT_ACTIVE,
    NOT_YET_VALID,
    EXPIRED,
    USAGE_LIMIT_REACHED,
    CAMPAIGN_INACTIVE,
    STATION_MISMATCH,
    FUEL_TYPE_MISMATCH,
    MINIMUM_PURCHASE_NOT_MET,
    CONCURRENT_UPDATE
}
