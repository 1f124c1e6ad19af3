package quest.gekko.salesboard.service.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import quest.gekko.salesboard.IntegrationTestSupport;
import quest.gekko.salesboard.domain.*;
import quest.gekko.salesboard.dto.RecomputeSummary;
import quest.gekko.salesboard.repository.WeeklyDistributionRepository;
import quest.gekko.salesboard.service.exception.ConcurrencyException;
import quest.gekko.salesboard.service.validation.ValidationException;
import quest.gekko.salesboard.util.PeriodLocks;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TargetAllocationServiceIntegrationTest extends IntegrationTestSupport {

    @Autowired
    WeeklyDistributionRepository distributionRepository;
    @Autowired
    PeriodLocks periodLocks;

    private record Row(int week, String user, long category, BigDecimal value) {}

    private List<Row> rows(Long periodId) {
        return allocationService.targets(periodId).stream()
                .map(t -> new Row(t.getWeekIndex(), t.getUserId(), t.getCategoryId(), t.getTargetValue()))
                .toList();
    }

    @Test
    @DisplayName("Recompute splits each week's junior share evenly and clears the dirty flag")
    void recomputeDerivesUserWeekTargets() {
        String shop = newShop();
        Period period = configuredPeriod(shop);
        assertTrue(recalcState.isDirty(period.getId()));

        RecomputeSummary summary = allocationService.recompute(period.getId());

        // 4 weeks with a share, 3 juniors + 1 senior each
        assertEquals(16, summary.targetRows());
        assertTrue(summary.unallocated().isEmpty());
        assertFalse(recalcState.isDirty(period.getId()));

        List<Row> week1 = rows(period.getId()).stream().filter(r -> r.week() == 1).toList();
        assertEquals(List.of("junior-a", "junior-b", "junior-c", "senior-a"), week1.stream().map(Row::user).toList());
        week1.stream().filter(r -> r.user().startsWith("junior"))
                .forEach(r -> assertEquals(0, r.value().compareTo(d("50.00"))));
        assertEquals(0, week1.get(3).value().compareTo(d("100.00")));

        BigDecimal total = rows(period.getId()).stream().map(Row::value).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, total.compareTo(d("1000.00")));
    }

    @Test
    void recomputeIsIdempotent() {
        Period period = configuredPeriod(newShop());

        RecomputeSummary first = allocationService.recompute(period.getId());
        List<Row> before = rows(period.getId());
        RecomputeSummary second = allocationService.recompute(period.getId());

        assertFalse(first.unchanged());
        assertTrue(second.unchanged());
        assertEquals(before, rows(period.getId()));
    }

    @Test
    @DisplayName("A failed recompute leaves the previous targets and the dirty flag in place")
    void failedRecomputeChangesNothing() {
        Period period = configuredPeriod(newShop());
        allocationService.recompute(period.getId());
        List<Row> before = rows(period.getId());

        // bypasses the write-time cap
        WeeklyDistribution week5 = distributionRepository.findByPeriodIdOrderByWeekIndexAsc(period.getId()).stream()
                .filter(w -> w.getWeekIndex() == 5).findFirst().orElseThrow();
        week5.setPercentage(d("30.00"));
        distributionRepository.save(week5);
        configurationService.upsertRoleWeights(period.getId(), 1, List.of(
                new PeriodConfigurationService.RoleWeightInput(MemberRole.SALES_JUNIOR, d("50.00"))));

        assertThrows(ValidationException.class, () -> allocationService.recompute(period.getId()));

        assertEquals(before, rows(period.getId()));
        assertTrue(recalcState.isDirty(period.getId()));
    }

    @Test
    void membershipChangeMarksPeriodDirtyAndShiftsShares() {
        String shop = newShop();
        Period period = configuredPeriod(shop);
        allocationService.recompute(period.getId());

        membershipService.upsertMembership(shop, "junior-c", MemberRole.SALES_JUNIOR, false);
        assertTrue(recalcState.isDirty(period.getId()));
        assertTrue(recalcState.find(period.getId()).orElseThrow().reason().contains("junior-c"));

        allocationService.recompute(period.getId());
        List<Row> week1Juniors = rows(period.getId()).stream()
                .filter(r -> r.week() == 1 && r.user().startsWith("junior")).toList();
        assertEquals(2, week1Juniors.size());
        week1Juniors.forEach(r -> assertEquals(0, r.value().compareTo(d("75.00"))));
    }

    @Test
    void roleWithoutMembersIsReportedNotAllocated() {
        String shop = newShop();
        Period period = configuredPeriod(shop);
        membershipService.upsertMembership(shop, "senior-a", MemberRole.SALES_SENIOR, false);

        RecomputeSummary summary = allocationService.recompute(period.getId());

        assertEquals(12, summary.targetRows());
        assertEquals(4, summary.unallocated().size());
        assertTrue(summary.unallocated().stream().allMatch(u -> u.role() == MemberRole.SALES_SENIOR));
    }

    @Test
    @DisplayName("Recompute fails fast with a retryable error while the period is held elsewhere")
    void concurrentRecomputeIsRejected() throws Exception {
        Period period = configuredPeriod(newShop());
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> holder = executor.submit(() -> periodLocks.call(period.getId(), () -> {
                held.countDown();
                try {
                    return release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }));
            assertTrue(held.await(5, TimeUnit.SECONDS));

            ConcurrencyException ex = assertThrows(ConcurrencyException.class, () -> allocationService.recompute(period.getId()));
            assertTrue(ex.isRetryable());
            assertThrows(ConcurrencyException.class, () -> configurationService.upsertWeeklyDistribution(period.getId(),
                    List.of(new PeriodConfigurationService.DistributionInput(5, d("0.00")))));

            release.countDown();
            assertTrue(holder.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(16, allocationService.recompute(period.getId()).targetRows());
    }
}
