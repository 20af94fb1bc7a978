package com.couponengine.campaigns;

import com.couponengine.coupons.Discount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaCampaignStore timestamps and slot reservation.
 */
@ExtendWith(MockitoExtension.class)
class JpaCampaignStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    @Mock
    private CampaignRepository campaignRepository;

    private JpaCampaignStore campaignStore;

    @BeforeEach
    void setUp() {
        campaignStore = new JpaCampaignStore(campaignRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testNewCampaignStampedFromClock() {
        when(campaignRepository.save(any(Campaign.class))).thenAnswer(invocation -> invocation.getArgument(0));
        Campaign campaign = new Campaign("Clocked", CampaignStatus.ACTIVE, null, NOW.plus(1, ChronoUnit.DAYS),
            Discount.none(), 0, null);

        Campaign saved = campaignStore.save(campaign);

        assertEquals(NOW, saved.getCreatedAt());
        assertEquals(NOW, saved.getUpdatedAt());
    }

    @Test
    void testResaveKeepsCreatedAt() {
        when(campaignRepository.save(any(Campaign.class))).thenAnswer(invocation -> invocation.getArgument(0));
        Campaign campaign = new Campaign("Existing", CampaignStatus.ACTIVE, null, NOW.plus(1, ChronoUnit.DAYS),
            Discount.none(), 0, null);
        Instant created = NOW.minus(3, ChronoUnit.DAYS);
        campaign.setCreatedAt(created);

        Campaign saved = campaignStore.save(campaign);

        assertEquals(created, saved.getCreatedAt());
        assertEquals(NOW, saved.getUpdatedAt());
    }

    @Test
    void testReservationReportsWhetherSlotsWereTaken() {
        when(campaignRepository.reserveGeneratedCoupons(eq(4L), eq(5), eq(NOW))).thenReturn(1);
        when(campaignRepository.reserveGeneratedCoupons(eq(4L), eq(50), eq(NOW))).thenReturn(0);

        assertTrue(campaignStore.reserveGeneratedCoupons(4L, 5));
        assertFalse(campaignStore.reserveGeneratedCoupons(4L, 50));
        verify(campaignRepository, never()).incrementGeneratedCoupons(any(), any());
        verify(campaignRepository, times(2)).reserveGeneratedCoupons(eq(4L), anyInt(), eq(NOW));
    }
}
