package com.couponengine.rules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Rules engine that evaluates the redemption rules in order.
 *
 * Rules never short-circuit each other: every violation is collected so a caller can
 * present all problems at once. Rule order comes from their {@code @Order} values.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RulesEngine {

    private final List<RedemptionRule> rules;

    /**
     * Evaluate all rules against a redemption context.
     *
     * @param context the redemption context to evaluate
     * @return violations in rule order; empty if the coupon is redeemable
     */
    public List<Violation> evaluateRules(RedemptionContext context) {
        return evaluate(context, rule -> true);
    }

    /**
     * Evaluate only the rules that must hold when a use is consumed
     * (status, validity window, usage limit).
     */
    public List<Violation> evaluateConsumptionRules(RedemptionContext context) {
        return evaluate(context, RedemptionRule::appliesAtConsumption);
    }

    private List<Violation> evaluate(RedemptionContext context, Predicate<RedemptionRule> selector) {
        Long couponId = context.getCoupon().getId();
        List<Violation> violations = new ArrayList<>();

        for (RedemptionRule rule : rules) {
            if (!selector.test(rule)) {
                continue;
            }
            RuleResult result = rule.evaluate(context);
            if (result.isPassed()) {
                log.debug("Rule {} passed for coupon {}", rule.getRuleName(), couponId);
            } else {
                log.debug("Rule {} failed for coupon {}: {}",
                    rule.getRuleName(), couponId, result.getViolation().getMessage());
                violations.add(result.getViolation());
            }
        }

        if (!violations.isEmpty()) {
            log.info("Coupon {} failed {} rule(s): {}", couponId, violations.size(),
                violations.stream().map(Violation::getType).toList());
        }
        return violations;
    }
}
