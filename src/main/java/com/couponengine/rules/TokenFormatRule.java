package com.couponengine.rules;

import com.couponengine.tokens.CouponTokenVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that rejects tokens whose structure does not match the coupon token layout.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class TokenFormatRule implements RedemptionRule {

    private final CouponTokenVerifier verifier;

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        if (!verifier.isWellFormed(context.getToken())) {
            return RuleResult.fail(ViolationType.MALFORMED_TOKEN, "Invalid QR token format");
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "TokenFormat";
    }
}
