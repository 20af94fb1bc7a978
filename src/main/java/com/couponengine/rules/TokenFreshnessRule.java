package com.couponengine.rules;

import com.couponengine.tokens.CouponTokenVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that rejects tokens older than the configured maximum age, regardless of the
 * coupon's own validity window. Catches leaked QR images replayed long after issuance.
 */
@Component
@Order(30)
@RequiredArgsConstructor
public class TokenFreshnessRule implements RedemptionRule {

    private final CouponTokenVerifier verifier;

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        if (verifier.isStale(context.getToken())) {
            return RuleResult.fail(ViolationType.TOKEN_STALE,
                String.format("QR token has expired due to age (max age %s)", verifier.getMaxTokenAge()));
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "TokenFreshness";
    }
}
