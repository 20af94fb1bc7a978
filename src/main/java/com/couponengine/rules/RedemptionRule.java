package com.couponengine.rules;

/**
 * Interface for redemption eligibility rules.
 *
 * Each rule inspects a redemption context and reports at most one violation.
 */
public interface RedemptionRule {

    /**
     * Evaluate the rule against a redemption context.
     *
     * @param context the coupon and redemption circumstances to evaluate
     * @return the result of the rule evaluation
     */
    RuleResult evaluate(RedemptionContext context);

    /**
     * Get the name of this rule.
     */
    String getRuleName();

    /**
     * Whether the rule must be re-checked when a use is actually consumed, since the
     * coupon may have changed after it was validated.
     */
    default boolean appliesAtConsumption() {
        return false;
    }
}
