package com.couponengine.audit;

import com.couponengine.coupons.Coupon;
import com.couponengine.coupons.CouponStatus;
import com.couponengine.coupons.CouponStore;
import com.couponengine.tokens.CouponTokenVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Data-quality checks over stored coupons.
 *
 * Never mutates a coupon and never takes part in redemption.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CouponIntegrityAuditor {

    private final CouponStore couponStore;
    private final CouponTokenVerifier tokenVerifier;

    public IntegrityReport checkIntegrity(Coupon coupon) {
        List<IntegrityIssue> issues = new ArrayList<>();

        if (!tokenVerifier.isWellFormed(coupon.getToken())) {
            issues.add(IntegrityIssue.INVALID_TOKEN_FORMAT);
        }
        if (!tokenVerifier.verifySignature(coupon.getToken(), coupon.getTokenSignature(), coupon)) {
            issues.add(IntegrityIssue.INVALID_SIGNATURE);
        }
        if (coupon.getValidFrom() != null && coupon.getValidUntil() != null
            && coupon.getValidFrom().isAfter(coupon.getValidUntil())) {
            issues.add(IntegrityIssue.INVERTED_DATE_RANGE);
        }
        if (coupon.getMaxUses() != null && coupon.getCurrentUses() > coupon.getMaxUses()) {
            issues.add(IntegrityIssue.USAGE_OVERRUN);
        }
        if (coupon.getDiscountAmount() != null && coupon.getDiscountPercentage() != null) {
            issues.add(IntegrityIssue.CONFLICTING_DISCOUNT_TYPES);
        }
        if (coupon.getStatus() == CouponStatus.USED_UP
            && !Objects.equals(coupon.getMaxUses(), coupon.getCurrentUses())) {
            issues.add(IntegrityIssue.STATUS_USAGE_MISMATCH);
        }

        if (!issues.isEmpty()) {
            log.warn("Coupon {} failed integrity check: {}", coupon.getId(), issues);
        }
        return new IntegrityReport(coupon.getId(), coupon.getCouponCode(), List.copyOf(issues));
    }

    /**
     * Check every stored coupon.
     *
     * @return reports for the coupons with at least one issue
     */
    @Transactional(readOnly = true)
    public List<IntegrityReport> auditAll() {
        List<Coupon> coupons = couponStore.findAll();
        List<IntegrityReport> failing = coupons.stream()
            .map(this::checkIntegrity)
            .filter(report -> !report.isIntact())
            .toList();
        log.info("Integrity audit checked {} coupon(s), {} with issues", coupons.size(), failing.size());
        return failing;
    }
}
