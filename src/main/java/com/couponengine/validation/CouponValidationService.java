package com.couponengine.validation;

import com.couponengine.common.exception.CouponNotFoundException;
import com.couponengine.coupons.Coupon;
import com.couponengine.coupons.CouponStatus;
import com.couponengine.coupons.CouponStore;
import com.couponengine.rules.RedemptionContext;
import com.couponengine.rules.RulesEngine;
import com.couponengine.rules.Violation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only redemption validation.
 *
 * Validation flow:
 * 1. Resolve the coupon by token or coupon code (a miss ends validation)
 * 2. Run every redemption rule against the stored record
 * 3. Report all violations together
 *
 * Nothing here mutates state, so it may be called any number of times. Collaborator
 * failures propagate; business conditions are reported as violations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class CouponValidationService {

    private final CouponStore couponStore;
    private final RulesEngine rulesEngine;
    private final Clock clock;

    public ValidationOutcome validateForRedemption(String token, Long stationId,
                                                   String fuelType, BigDecimal purchaseAmount) {
        log.info("Validating coupon token for redemption: stationId={}, fuelType={}, purchaseAmount={}",
            stationId, fuelType, purchaseAmount);

        Optional<Coupon> coupon = token == null ? Optional.empty() : couponStore.findByToken(token);
        if (coupon.isEmpty()) {
            log.info("No coupon for presented token");
            return ValidationOutcome.notFound();
        }
        return validate(token, coupon.get(), stationId, fuelType, purchaseAmount);
    }

    /**
     * Same pipeline, with the coupon resolved by its human-readable code. The token
     * checks run against the coupon's stored token.
     */
    public ValidationOutcome validateByCouponCode(String couponCode, Long stationId,
                                                  String fuelType, BigDecimal purchaseAmount) {
        log.info("Validating coupon by code: couponCode={}, stationId={}", couponCode, stationId);

        Optional<Coupon> coupon = couponCode == null ? Optional.empty() : couponStore.findByCouponCode(couponCode);
        if (coupon.isEmpty()) {
            log.info("No coupon with code {}", couponCode);
            return ValidationOutcome.notFound();
        }
        return validate(coupon.get().getToken(), coupon.get(), stationId, fuelType, purchaseAmount);
    }

    /**
     * Validate each token independently; one outcome per input, in input order.
     */
    public List<ValidationOutcome> validateBatch(List<String> tokens, Long stationId,
                                                 String fuelType, BigDecimal purchaseAmount) {
        log.info("Validating {} coupon tokens, stationId={}", tokens.size(), stationId);
        return tokens.stream()
            .map(token -> validateForRedemption(token, stationId, fuelType, purchaseAmount))
            .toList();
    }

    public List<ValidationOutcome> validateBatchByCouponCode(List<String> couponCodes, Long stationId,
                                                             String fuelType, BigDecimal purchaseAmount) {
        log.info("Validating {} coupon codes, stationId={}", couponCodes.size(), stationId);
        return couponCodes.stream()
            .map(code -> validateByCouponCode(code, stationId, fuelType, purchaseAmount))
            .toList();
    }

    public PreValidationResult preValidate(String token) {
        Optional<Coupon> found = token == null ? Optional.empty() : couponStore.findByToken(token);
        if (found.isEmpty()) {
            return PreValidationResult.notFound();
        }

        Coupon coupon = found.get();
        boolean expired = coupon.isExpiredAt(Instant.now(clock)) || coupon.getStatus() == CouponStatus.EXPIRED;

        return PreValidationResult.builder()
            .exists(true)
            .active(coupon.isActive() && !expired)
            .expired(expired)
            .campaignId(coupon.getCampaignId())
            .campaignName(coupon.getCampaign() != null ? coupon.getCampaign().getName() : null)
            .discountSummary(coupon.describeDiscount())
            .build();
    }

    public CouponUsageStats getUsageStats(Long couponId) {
        Coupon coupon = couponStore.findById(couponId)
            .orElseThrow(() -> new CouponNotFoundException(couponId));

        return CouponUsageStats.builder()
            .couponId(coupon.getId())
            .couponCode(coupon.getCouponCode())
            .currentUses(coupon.getCurrentUses())
            .maxUses(coupon.getMaxUses())
            .remainingUses(coupon.getRemainingUses())
            .usagePercentage(coupon.getUsagePercentage())
            .maxUsesReached(!coupon.hasRemainingCapacity())
            .build();
    }

    private ValidationOutcome validate(String token, Coupon coupon, Long stationId,
                                       String fuelType, BigDecimal purchaseAmount) {
        RedemptionContext context = RedemptionContext.builder()
            .token(token)
            .coupon(coupon)
            .stationId(stationId)
            .fuelType(fuelType)
            .purchaseAmount(purchaseAmount)
            .evaluatedAt(Instant.now(clock))
            .build();

        List<Violation> violations = rulesEngine.evaluateRules(context);
        ValidationOutcome outcome = ValidationOutcome.of(coupon, violations);

        log.info("Coupon {} validation: valid={}, canBeUsed={}",
            coupon.getId(), outcome.isValid(), outcome.isCanBeUsed());
        return outcome;
    }
}
