package com.couponengine.tokens;

import lombok.Value;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decoded coupon token.
 *
 * Layout: {@code CPN_v1_<campaignId>_<sequence>_<issuedAt>_<nonce>_<couponCode>} where the
 * campaign id is zero-padded to at least six digits, the sequence has six digits, the
 * issuance time is {@code uuuuMMddHHmmss} in UTC, the nonce is eight characters of
 * [A-Z0-9] and the coupon code is 6 to 50 characters of [A-Z0-9].
 */
@Value
public class CouponToken {

    public static final String PREFIX = "CPN";
    public static final String VERSION = "v1";

    private static final String DELIMITER = "_";
    private static final int TIMESTAMP_SEGMENT = 4;

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
        .ofPattern("uuuuMMddHHmmss")
        .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern FORMAT = Pattern.compile(
        "^" + PREFIX + DELIMITER + VERSION
            + "_(\\d{6,12})_(\\d{6})_(\\d{14})_([A-Z0-9]{8})_([A-Z0-9]{6,50})$");

    Long campaignId;
    int sequence;
    Instant issuedAt;
    String nonce;
    String couponCode;

    public String encode() {
        return String.join(DELIMITER,
            PREFIX,
            VERSION,
            String.format("%06d", campaignId),
            String.format("%06d", sequence),
            formatTimestamp(issuedAt),
            nonce,
            couponCode);
    }

    /**
     * Parse a token string, checking every segment.
     *
     * @return the decoded token, or empty if the string is not a well-formed token
     */
    public static Optional<CouponToken> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        Matcher matcher = FORMAT.matcher(token);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return parseTimestamp(matcher.group(3)).map(issuedAt -> new CouponToken(
            Long.parseLong(matcher.group(1)),
            Integer.parseInt(matcher.group(2)),
            issuedAt,
            matcher.group(4),
            matcher.group(5)));
    }

    /**
     * Read only the issuance time, without requiring the rest of the token to be well-formed.
     */
    public static Optional<Instant> extractIssuedAt(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] segments = token.split(DELIMITER, -1);
        if (segments.length <= TIMESTAMP_SEGMENT) {
            return Optional.empty();
        }
        return parseTimestamp(segments[TIMESTAMP_SEGMENT]);
    }

    /**
     * Canonical bytes covered by a coupon signature: the token plus the immutable
     * issuance fields of the coupon record.
     */
    public static String canonicalPayload(String token, Long campaignId, String couponCode, Instant issuedAt) {
        return token + "|" + campaignId + "|" + couponCode + "|" + issuedAt.getEpochSecond();
    }

    static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    private static Optional<Instant> parseTimestamp(String value) {
        try {
            return Optional.of(LocalDateTime.parse(value, TIMESTAMP_FORMAT).toInstant(ZoneOffset.UTC));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
