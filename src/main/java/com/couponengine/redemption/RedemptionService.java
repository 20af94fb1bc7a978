package com.couponengine.redemption;

import com.couponengine.common.exception.CouponNotUsableException;
import com.couponengine.coupons.Coupon;
import com.couponengine.coupons.CouponLifecycleService;
import com.couponengine.coupons.Discount;
import com.couponengine.rules.Violation;
import com.couponengine.validation.CouponValidationService;
import com.couponengine.validation.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Service for redeeming coupons at a station.
 *
 * Redemption flow:
 * 1. Validate the coupon against the redemption context
 * 2. Decline with every violation if it is not usable
 * 3. Consume one use (re-checked and compare-and-set in its own transaction)
 * 4. Return the discount and raffle tickets granted
 *
 * Validation and consumption run in separate transactions. A coupon that became unusable
 * in between is declined by the consumption re-check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedemptionService {

    private final CouponValidationService validationService;
    private final CouponLifecycleService lifecycleService;

    public RedemptionResult redeem(RedemptionRequest request) {
        log.info("Processing redemption at station {} fuelType={} amount={}",
            request.getStationId(), request.getFuelType(), request.getPurchaseAmount());

        ValidationOutcome outcome = request.getToken() != null
            ? validationService.validateForRedemption(request.getToken(), request.getStationId(),
                request.getFuelType(), request.getPurchaseAmount())
            : validationService.validateByCouponCode(request.getCouponCode(), request.getStationId(),
                request.getFuelType(), request.getPurchaseAmount());

        if (!outcome.isFound()) {
            log.info("Redemption DECLINED: coupon not found");
            return RedemptionResult.declined(null, request.getCouponCode(), outcome.getViolations());
        }

        Coupon coupon = outcome.getCoupon();
        if (!outcome.isCanBeUsed()) {
            List<Violation> violations = outcome.getViolations();
            log.info("Redemption of coupon {} DECLINED: {}", coupon.getId(),
                violations.stream().map(Violation::getType).toList());
            return RedemptionResult.declined(coupon.getId(), coupon.getCouponCode(), violations);
        }

        Coupon consumed;
        try {
            consumed = lifecycleService.consumeUse(coupon.getId());
        } catch (CouponNotUsableException e) {
            log.info("Redemption of coupon {} DECLINED at consumption: {}", coupon.getId(), e.getMessage());
            return RedemptionResult.declined(coupon.getId(), coupon.getCouponCode(), e.getViolations());
        }

        Discount discount = consumed.getDiscount();
        BigDecimal purchaseAmount = request.getPurchaseAmount();
        BigDecimal discountAmount = discount.calculate(purchaseAmount);

        log.info("Redemption of coupon {} APPROVED: discount {} and {} raffle ticket(s)",
            consumed.getId(), discountAmount, consumed.getRaffleTickets());

        return RedemptionResult.builder()
            .status(RedemptionStatus.APPROVED)
            .couponId(consumed.getId())
            .couponCode(consumed.getCouponCode())
            .discountAmount(discountAmount)
            .amountDue(purchaseAmount != null ? purchaseAmount.subtract(discountAmount) : null)
            .raffleTickets(consumed.getRaffleTickets())
            .currentUses(consumed.getCurrentUses())
            .remainingUses(consumed.getRemainingUses())
            .build();
    }
}
