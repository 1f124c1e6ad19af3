package quest.gekko.salesboard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.salesboard.domain.Period;
import quest.gekko.salesboard.dto.CategoryPerformanceView;
import quest.gekko.salesboard.dto.RecalcStateView;
import quest.gekko.salesboard.dto.RecomputeSummary;
import quest.gekko.salesboard.dto.WeeklyProgressView;
import quest.gekko.salesboard.service.core.PeriodService;
import quest.gekko.salesboard.service.core.ProgressService;
import quest.gekko.salesboard.service.core.RecalcStateService;
import quest.gekko.salesboard.service.core.TargetAllocationService;
import quest.gekko.salesboard.service.validation.ValidationException;
import quest.gekko.salesboard.web.dto.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/periods/{periodId}")
@RequiredArgsConstructor
public class PeriodController {
    private final PeriodService periodService;
    private final TargetAllocationService allocationService;
    private final RecalcStateService recalcState;
    private final ProgressService progressService;

    @GetMapping
    public PeriodView period(@PathVariable Long periodId,
                             @RequestParam(name = "include_weeks", defaultValue = "false") boolean includeWeeks) {
        Period period = periodService.getPeriod(periodId);
        return includeWeeks ? PeriodView.from(period, periodService.getWeeks(periodId)) : PeriodView.from(period);
    }

    @GetMapping("/weeks")
    public List<WeekView> weeks(@PathVariable Long periodId) {
        return periodService.getWeeks(periodId).stream().map(WeekView::from).toList();
    }

    @PatchMapping("/status")
    public PeriodView changeStatus(@PathVariable Long periodId, @RequestBody Requests.StatusChange body) {
        if (body.status() == null) {
            throw ValidationException.of("status", "period=" + periodId, "status is required");
        }
        return PeriodView.from(periodService.requestStatusTransition(periodId, body.status()));
    }

    @PostMapping("/recompute")
    public RecomputeSummary recompute(@PathVariable Long periodId) {
        return allocationService.recompute(periodId);
    }

    @GetMapping("/recalc-state")
    public RecalcStateView recalcState(@PathVariable Long periodId) {
        periodService.getPeriod(periodId);
        return recalcState.find(periodId)
                .orElseGet(() -> new RecalcStateView(periodId, true, "never recomputed", null, null));
    }

    @GetMapping("/user-week-targets")
    public List<UserWeekTargetView> userWeekTargets(@PathVariable Long periodId) {
        periodService.getPeriod(periodId);
        return allocationService.targets(periodId).stream().map(UserWeekTargetView::from).toList();
    }

    @GetMapping("/category-performance")
    public List<CategoryPerformanceView> categoryPerformance(@PathVariable Long periodId) {
        return progressService.categoryPerformance(periodId);
    }

    @GetMapping("/weekly-progress")
    public List<WeeklyProgressView> weeklyProgress(@PathVariable Long periodId) {
        return progressService.weeklyProgress(periodId);
    }
}
