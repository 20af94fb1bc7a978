package com.couponengine.redemption;

import com.couponengine.rules.Violation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response to a redemption request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RedemptionResult {

    private RedemptionStatus status;
    private Long couponId;
    private String couponCode;
    private BigDecimal discountAmount;
    /**
     * Purchase amount after the discount; null when no purchase amount was given.
     */
    private BigDecimal amountDue;
    private int raffleTickets;
    private int currentUses;
    private Integer remainingUses;
    @Builder.Default
    private List<Violation> violations = List.of();

    public boolean isApproved() {
        return status == RedemptionStatus.APPROVED;
    }

    public String getDeclineReason() {
        if (violations == null || violations.isEmpty()) {
            return null;
        }
        return violations.stream().map(Violation::getMessage).collect(Collectors.joining("; "));
    }

    public static RedemptionResult declined(Long couponId, String couponCode, List<Violation> violations) {
        return RedemptionResult.builder()
            .status(RedemptionStatus.DECLINED)
            .couponId(couponId)
            .couponCode(couponCode)
            .violations(List.copyOf(violations))
            .build();
    }
}
