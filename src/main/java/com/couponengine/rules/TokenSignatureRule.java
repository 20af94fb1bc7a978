package com.couponengine.rules;

import com.couponengine.coupons.Coupon;
import com.couponengine.tokens.CouponTokenVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that checks the stored signature against the presented token and the coupon's
 * issuance fields.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class TokenSignatureRule implements RedemptionRule {

    private final CouponTokenVerifier verifier;

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        Coupon coupon = context.getCoupon();

        if (!verifier.verifySignature(context.getToken(), coupon.getTokenSignature(), coupon)) {
            return RuleResult.fail(ViolationType.SIGNATURE_INVALID,
                "Invalid QR token signature - possible tampering detected");
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "TokenSignature";
    }
}
