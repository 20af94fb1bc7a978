package com.couponengine.rules;

import com.couponengine.campaigns.Campaign;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that requires the owning campaign to be ACTIVE.
 */
@Component
@Order(70)
public class CampaignStateRule implements RedemptionRule {

    @Override
    public RuleResult evaluate(RedemptionContext context) {
        Campaign campaign = context.getCoupon().getCampaign();

        if (campaign == null || !campaign.isActive()) {
            return RuleResult.fail(ViolationType.CAMPAIGN_INACTIVE,
                String.format("Campaign is not active (status: %s)",
                    campaign == null ? null : campaign.getStatus()));
        }
        return RuleResult.pass();
    }

    @Override
    public String getRuleName() {
        return "CampaignState";
    }
}
