package com.couponengine.coupons;

import com.couponengine.campaigns.Campaign;
import com.couponengine.campaigns.CampaignStore;
import com.couponengine.common.exception.CampaignNotFoundException;
import com.couponengine.common.exception.InvalidCampaignStateException;
import com.couponengine.tokens.CouponTokenSigner;
import com.couponengine.tokens.SignedCouponToken;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Service for issuing coupons into a campaign.
 *
 * Issuance flow:
 * 1. Check the campaign exists and is active
 * 2. Resolve the coupon code and make sure it is unused
 * 3. Take a slot in the campaign's capacity
 * 4. Allocate and sign the token
 * 5. Store the coupon
 *
 * Batch generation follows the same steps but takes every capacity slot in one write.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CouponIssuanceService {

    private static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int GENERATED_CODE_LENGTH = 12;
    private static final int CODE_GENERATION_ATTEMPTS = 5;
    static final int MAX_BATCH_SIZE = 10_000;

    private final CampaignStore campaignStore;
    private final CouponStore couponStore;
    private final CouponTokenSigner tokenSigner;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Transactional
    public Coupon issueCoupon(@Valid IssueCouponCommand command) {
        Campaign campaign = loadActiveCampaign(command.getCampaignId());
        String couponCode = resolveCouponCode(command.getCouponCode());
        Instant now = Instant.now(clock);
        ValidityWindow window = resolveValidity(command, campaign, now);

        if (!campaignStore.incrementGeneratedCoupons(campaign.getId())) {
            throw new InvalidCampaignStateException(campaign.getId(),
                "maximum of " + campaign.getMaxCoupons() + " coupons reached");
        }

        Coupon saved = couponStore.save(newCoupon(campaign, command, couponCode, now, window));
        log.info("Issued coupon {} ({}) in campaign {}, valid {} to {}",
            saved.getId(), couponCode, campaign.getId(), window.from, window.until);
        return saved;
    }

    /**
     * Issue {@code quantity} coupons with generated codes and the same terms.
     *
     * Capacity is checked once for the whole batch: either every coupon fits in the campaign
     * or none is issued.
     *
     * @param terms discount, applicability and validity shared by every coupon; must not carry a code
     */
    @Transactional
    public List<Coupon> generateCoupons(@Valid IssueCouponCommand terms,
                                        @Min(1) @Max(MAX_BATCH_SIZE) int quantity) {
        if (terms.getCouponCode() != null) {
            throw new IllegalArgumentException("Batch generation assigns coupon codes; do not pass one");
        }
        Campaign campaign = loadActiveCampaign(terms.getCampaignId());
        Integer remaining = campaign.getRemainingCapacity();
        if (remaining != null && quantity > remaining) {
            throw new InvalidCampaignStateException(campaign.getId(),
                "requested " + quantity + " coupons exceeds remaining capacity " + remaining);
        }

        Instant now = Instant.now(clock);
        ValidityWindow window = resolveValidity(terms, campaign, now);

        if (!campaignStore.reserveGeneratedCoupons(campaign.getId(), quantity)) {
            throw new InvalidCampaignStateException(campaign.getId(),
                "capacity for " + quantity + " more coupons is no longer available");
        }

        Set<String> batchCodes = new HashSet<>();
        List<Coupon> issued = new ArrayList<>(quantity);
        for (int i = 0; i < quantity; i++) {
            String couponCode = resolveCouponCode(null);
            while (!batchCodes.add(couponCode)) {
                couponCode = resolveCouponCode(null);
            }
            issued.add(couponStore.save(newCoupon(campaign, terms, couponCode, now, window)));
        }
        log.info("Generated {} coupon(s) in campaign {}, valid {} to {}",
            issued.size(), campaign.getId(), window.from, window.until);
        return issued;
    }

    private Campaign loadActiveCampaign(Long campaignId) {
        Campaign campaign = campaignStore.findById(campaignId)
            .orElseThrow(() -> new CampaignNotFoundException(campaignId));
        if (!campaign.isActive()) {
            throw new InvalidCampaignStateException(campaign.getId(), "campaign is " + campaign.getStatus());
        }
        return campaign;
    }

    private ValidityWindow resolveValidity(IssueCouponCommand command, Campaign campaign, Instant now) {
        Instant validFrom = command.getValidFrom() != null ? command.getValidFrom() : now;
        Instant validUntil = command.getValidUntil() != null ? command.getValidUntil() : campaign.getEndsAt();
        if (validUntil == null) {
            throw new IllegalArgumentException("Valid until is required when the campaign has no end date");
        }
        if (validFrom.isAfter(validUntil)) {
            throw new IllegalArgumentException("Valid from " + validFrom + " is after valid until " + validUntil);
        }
        return new ValidityWindow(validFrom, validUntil);
    }

    private Coupon newCoupon(Campaign campaign, IssueCouponCommand command, String couponCode,
                             Instant now, ValidityWindow window) {
        SignedCouponToken signed = tokenSigner.signCouponToken(campaign.getId(), couponCode, now);

        Coupon coupon = new Coupon(campaign, couponCode, signed.getToken(), signed.getSignature(),
            signed.getIssuedAt(), window.from, window.until);
        coupon.applyDiscount(resolveDiscount(command, campaign));
        coupon.setMinimumPurchaseAmount(command.getMinimumPurchaseAmount());
        if (command.getApplicableFuelTypes() != null) {
            coupon.setApplicableFuelTypes(new HashSet<>(command.getApplicableFuelTypes()));
        }
        if (command.getApplicableStations() != null) {
            coupon.setApplicableStations(new HashSet<>(command.getApplicableStations()));
        }
        coupon.setMaxUses(command.getMaxUses());
        coupon.setRaffleTickets(command.getRaffleTickets() != null
            ? command.getRaffleTickets() : campaign.getDefaultRaffleTickets());
        return coupon;
    }

    private String resolveCouponCode(String requested) {
        if (requested != null) {
            if (couponStore.existsByCouponCode(requested)) {
                throw new IllegalArgumentException("Coupon code already exists: " + requested);
            }
            return requested;
        }
        for (int i = 0; i < CODE_GENERATION_ATTEMPTS; i++) {
            String candidate = generateCode();
            if (!couponStore.existsByCouponCode(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a unique coupon code");
    }

    private Discount resolveDiscount(IssueCouponCommand command, Campaign campaign) {
        if (command.getDiscountAmount() != null) {
            return Discount.fixedAmount(command.getDiscountAmount());
        }
        if (command.getDiscountPercentage() != null) {
            return Discount.percentage(command.getDiscountPercentage());
        }
        return campaign.getDefaultDiscount();
    }

    private String generateCode() {
        StringBuilder code = new StringBuilder(GENERATED_CODE_LENGTH);
        for (int i = 0; i < GENERATED_CODE_LENGTH; i++) {
            code.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return code.toString();
    }

    private static final class ValidityWindow {
        private final Instant from;
        private final Instant until;

        private ValidityWindow(Instant from, Instant until) {
            this.from = from;
            this.until = until;
        }
    }
}
