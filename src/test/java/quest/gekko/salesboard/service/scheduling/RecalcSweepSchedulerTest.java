package quest.gekko.salesboard.service.scheduling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.retry.support.RetryTemplate;
import quest.gekko.salesboard.domain.Period;
import quest.gekko.salesboard.domain.PeriodStatus;
import quest.gekko.salesboard.dto.RecomputeSummary;
import quest.gekko.salesboard.repository.PeriodRepository;
import quest.gekko.salesboard.service.core.RecalcStateService;
import quest.gekko.salesboard.service.core.TargetAllocationService;
import quest.gekko.salesboard.service.exception.ConcurrencyException;
import quest.gekko.salesboard.service.validation.ValidationException;
import quest.gekko.salesboard.util.PeriodLocks;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecalcSweepSchedulerTest {

    @Mock
    RecalcStateService recalcState;
    @Mock
    PeriodRepository periodRepository;
    @Mock
    TargetAllocationService allocationService;
    @Mock
    PeriodLocks periodLocks;

    RecalcSweepScheduler scheduler;

    @BeforeEach
    void setup() {
        RetryTemplate retry = RetryTemplate.builder().maxAttempts(3).fixedBackoff(1).retryOn(ConcurrencyException.class).build();
        scheduler = new RecalcSweepScheduler(recalcState, periodRepository, allocationService, retry, periodLocks);
    }

    private static Period period(long id, PeriodStatus status) {
        Period p = new Period();
        p.setId(id);
        p.setStatus(status);
        return p;
    }

    @Test
    void retriesLockContentionThenSucceeds() {
        when(recalcState.dirtyPeriodIds()).thenReturn(List.of(1L));
        when(periodRepository.findById(1L)).thenReturn(Optional.of(period(1L, PeriodStatus.DRAFT)));
        when(allocationService.recompute(1L))
                .thenThrow(new ConcurrencyException(1L))
                .thenReturn(new RecomputeSummary(1L, 4, false, List.of()));

        scheduler.sweep();

        verify(allocationService, times(2)).recompute(1L);
    }

    @Test
    void invalidPeriodDoesNotStopTheSweep() {
        when(recalcState.dirtyPeriodIds()).thenReturn(List.of(1L, 2L));
        when(periodRepository.findById(1L)).thenReturn(Optional.of(period(1L, PeriodStatus.PUBLISHED)));
        when(periodRepository.findById(2L)).thenReturn(Optional.of(period(2L, PeriodStatus.DRAFT)));
        when(allocationService.recompute(1L)).thenThrow(ValidationException.of("weekly_distribution", "period=1", "too much"));
        when(allocationService.recompute(2L)).thenReturn(new RecomputeSummary(2L, 0, true, List.of()));

        scheduler.sweep();

        verify(allocationService, times(1)).recompute(1L);
        verify(allocationService).recompute(2L);
    }

    @Test
    void frozenPeriodsAreSkipped() {
        when(recalcState.dirtyPeriodIds()).thenReturn(List.of(3L));
        when(periodRepository.findById(3L)).thenReturn(Optional.of(period(3L, PeriodStatus.LOCKED)));

        scheduler.sweep();

        verifyNoInteractions(allocationService);
    }

    @Test
    void periodsBeingWrittenAreLeftForTheNextRun() {
        when(recalcState.dirtyPeriodIds()).thenReturn(List.of(4L, 5L));
        when(periodRepository.findById(4L)).thenReturn(Optional.of(period(4L, PeriodStatus.DRAFT)));
        when(periodRepository.findById(5L)).thenReturn(Optional.of(period(5L, PeriodStatus.DRAFT)));
        when(periodLocks.isLocked(4L)).thenReturn(true);
        when(allocationService.recompute(5L)).thenReturn(new RecomputeSummary(5L, 2, false, List.of()));

        scheduler.sweep();

        verify(allocationService, never()).recompute(4L);
        verify(allocationService).recompute(5L);
    }
}
