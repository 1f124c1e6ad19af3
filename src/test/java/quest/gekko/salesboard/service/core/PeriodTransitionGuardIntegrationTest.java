package quest.gekko.salesboard.service.core;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import quest.gekko.salesboard.IntegrationTestSupport;
import quest.gekko.salesboard.domain.MemberRole;
import quest.gekko.salesboard.domain.Period;
import quest.gekko.salesboard.domain.PeriodStatus;
import quest.gekko.salesboard.service.exception.PeriodStateException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Status changes with {@code salesboard.transitions.block-when-dirty} switched on.
 */
@SpringBootTest(properties = "salesboard.transitions.block-when-dirty=true")
class PeriodTransitionGuardIntegrationTest extends IntegrationTestSupport {

    @Test
    void publishingStaleTargetsIsRefused() {
        Period period = configuredPeriod(newShop());

        PeriodStateException ex = assertThrows(PeriodStateException.class,
                () -> periodService.requestStatusTransition(period.getId(), PeriodStatus.PUBLISHED));

        assertEquals("RECALC_PENDING", ex.getCode());
        assertFalse(ex.isRetryable());
        assertEquals(PeriodStatus.DRAFT, periodService.getPeriod(period.getId()).getStatus());
    }

    @Test
    void publishingAfterRecomputeSucceeds() {
        Period period = configuredPeriod(newShop());
        allocationService.recompute(period.getId());

        assertEquals(PeriodStatus.PUBLISHED, periodService.requestStatusTransition(period.getId(), PeriodStatus.PUBLISHED).getStatus());
    }

    @Test
    void membershipChangeBlocksTheNextTransition() {
        String shop = newShop();
        Period period = configuredPeriod(shop);
        allocationService.recompute(period.getId());
        periodService.requestStatusTransition(period.getId(), PeriodStatus.PUBLISHED);
        membershipService.upsertMembership(shop, "junior-d", MemberRole.SALES_JUNIOR, true);

        PeriodStateException ex = assertThrows(PeriodStateException.class,
                () -> periodService.requestStatusTransition(period.getId(), PeriodStatus.LOCKED));

        assertEquals("RECALC_PENDING", ex.getCode());
        assertEquals(PeriodStatus.PUBLISHED, periodService.getPeriod(period.getId()).getStatus());
    }
}
