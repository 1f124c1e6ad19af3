package quest.gekko.salesboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.salesboard.config.SalesboardProperties;
import quest.gekko.salesboard.domain.Period;
import quest.gekko.salesboard.domain.PeriodStatus;
import quest.gekko.salesboard.domain.PeriodWeek;
import quest.gekko.salesboard.repository.PeriodRepository;
import quest.gekko.salesboard.repository.PeriodWeekRepository;
import quest.gekko.salesboard.service.exception.NotFoundException;
import quest.gekko.salesboard.service.exception.PeriodStateException;
import quest.gekko.salesboard.service.validation.ConfigurationValidator;
import quest.gekko.salesboard.service.validation.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class PeriodService {

    static final int DAYS_PER_WEEK = 7;

    private static final Map<PeriodStatus, Set<PeriodStatus>> TRANSITIONS = new EnumMap<>(Map.of(
            PeriodStatus.DRAFT, EnumSet.of(PeriodStatus.PUBLISHED),
            PeriodStatus.PUBLISHED, EnumSet.of(PeriodStatus.DRAFT, PeriodStatus.LOCKED),
            PeriodStatus.LOCKED, EnumSet.of(PeriodStatus.ARCHIVED),
            PeriodStatus.ARCHIVED, EnumSet.noneOf(PeriodStatus.class)
    ));

    private final PeriodRepository periodRepository;
    private final PeriodWeekRepository weekRepository;
    private final PeriodTransactions periodTransactions;
    private final ConfigurationValidator validator;
    private final RecalcStateService recalcState;
    private final SalesboardProperties.Transitions transitions;
    private final Clock clock;

    /**
     * Returns the shop's period for the month, creating it together with its weeks when missing.
     */
    @Transactional
    public Period createPeriod(String shopId, int year, int month) {
        if (month < 1 || month > 12) {
            throw ValidationException.of("month", "shop=" + shopId, "month must be between 1 and 12");
        }
        return periodRepository.findByShopIdAndYearAndMonth(shopId, year, month)
                .orElseGet(() -> {
                    Period period = new Period();
                    period.setShopId(shopId);
                    period.setYear(year);
                    period.setMonth(month);
                    period.setStatus(PeriodStatus.DRAFT);
                    period.setCreatedAt(Instant.now(clock));
                    Period saved = periodRepository.save(period);
                    weekRepository.saveAll(generateWeeks(saved.getId(), saved.yearMonth()));
                    recalcState.markDirty(saved.getId(), "period created");
                    log.info("Created period {} for shop {} {}", saved.getId(), shopId, saved.yearMonth());
                    return saved;
                });
    }

    public Period getPeriod(Long periodId) {
        return periodRepository.findById(periodId)
                .orElseThrow(() -> new NotFoundException("Period", periodId));
    }

    public List<Period> listPeriods(String shopId) {
        return periodRepository.findByShopIdOrderByYearDescMonthDesc(shopId);
    }

    public List<PeriodWeek> getWeeks(Long periodId) {
        getPeriod(periodId);
        return weekRepository.findByPeriodIdOrderByWeekIndexAsc(periodId);
    }

    /**
     * Moves the period to a new status. Entering PUBLISHED or LOCKED requires every split to be
     * complete; asking for the current status is a no-op.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Period requestStatusTransition(Long periodId, PeriodStatus newStatus) {
        return periodTransactions.execute(periodId, () -> {
            Period period = periodRepository.lockById(periodId)
                    .orElseThrow(() -> new NotFoundException("Period", periodId));
            PeriodStatus current = period.getStatus();
            if (current == newStatus) return period;
            if (!canTransition(current, newStatus)) {
                throw PeriodStateException.invalidTransition(periodId, current, newStatus);
            }

            if (newStatus.requiresCompleteConfiguration()) {
                validator.validateForPublication(periodId).orThrow();
                recalcState.find(periodId)
                        .filter(state -> state.dirty())
                        .ifPresent(state -> {
                            if (transitions.blockWhenDirty()) {
                                throw PeriodStateException.stale(periodId, state.reason());
                            }
                            log.warn("Period {} moves to {} with stale targets: {}", periodId, newStatus, state.reason());
                        });
            }

            period.setStatus(newStatus);
            log.info("Period {} status {} -> {}", periodId, current, newStatus);
            return periodRepository.save(period);
        });
    }

    public static boolean canTransition(PeriodStatus from, PeriodStatus to) {
        return from == to || TRANSITIONS.get(from).contains(to);
    }

    /**
     * Consecutive 7-day weeks from the first of the month; the last one keeps whatever is left.
     */
    static List<PeriodWeek> generateWeeks(Long periodId, YearMonth month) {
        List<PeriodWeek> weeks = new ArrayList<>();
        LocalDate start = month.atDay(1);
        LocalDate last = month.atEndOfMonth();
        int index = 1;
        while (!start.isAfter(last)) {
            LocalDate end = start.plusDays(DAYS_PER_WEEK - 1);
            if (end.isAfter(last)) end = last;

            PeriodWeek week = new PeriodWeek();
            week.setPeriodId(periodId);
            week.setWeekIndex(index++);
            week.setStartDate(start);
            week.setEndDate(end);
            week.setDayCount(end.getDayOfMonth() - start.getDayOfMonth() + 1);
            weeks.add(week);

            start = end.plusDays(1);
        }
        return weeks;
    }
}
