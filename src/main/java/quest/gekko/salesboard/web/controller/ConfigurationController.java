package quest.gekko.salesboard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.salesboard.service.core.PeriodConfigurationService;
import quest.gekko.salesboard.service.core.PeriodService;
import quest.gekko.salesboard.service.validation.ConfigurationValidator;
import quest.gekko.salesboard.service.validation.ValidationScope;
import quest.gekko.salesboard.web.dto.DistributionView;
import quest.gekko.salesboard.web.dto.MonthlyTargetView;
import quest.gekko.salesboard.web.dto.RoleWeightView;
import quest.gekko.salesboard.web.dto.ValidationResultView;

import java.util.List;

@RestController
@RequestMapping("/api/v1/periods/{periodId}")
@RequiredArgsConstructor
public class ConfigurationController {
    private final PeriodConfigurationService configurationService;
    private final PeriodService periodService;
    private final ConfigurationValidator validator;

    @PutMapping("/targets")
    public List<MonthlyTargetView> putTargets(@PathVariable Long periodId,
                                              @RequestBody List<PeriodConfigurationService.TargetInput> body) {
        return configurationService.upsertMonthlyTargets(periodId, body).stream().map(MonthlyTargetView::from).toList();
    }

    @GetMapping("/targets")
    public List<MonthlyTargetView> targets(@PathVariable Long periodId) {
        periodService.getPeriod(periodId);
        return configurationService.monthlyTargets(periodId).stream().map(MonthlyTargetView::from).toList();
    }

    @PutMapping("/weekly-distribution")
    public List<DistributionView> putDistribution(@PathVariable Long periodId,
                                                  @RequestBody List<PeriodConfigurationService.DistributionInput> body) {
        return configurationService.upsertWeeklyDistribution(periodId, body).stream().map(DistributionView::from).toList();
    }

    @GetMapping("/weekly-distribution")
    public List<DistributionView> distribution(@PathVariable Long periodId) {
        periodService.getPeriod(periodId);
        return configurationService.weeklyDistribution(periodId).stream().map(DistributionView::from).toList();
    }

    @PutMapping("/role-weights/{weekIndex}")
    public List<RoleWeightView> putRoleWeights(@PathVariable Long periodId, @PathVariable int weekIndex,
                                               @RequestBody List<PeriodConfigurationService.RoleWeightInput> body) {
        return configurationService.upsertRoleWeights(periodId, weekIndex, body).stream().map(RoleWeightView::from).toList();
    }

    @GetMapping("/role-weights/{weekIndex}")
    public List<RoleWeightView> roleWeights(@PathVariable Long periodId, @PathVariable int weekIndex) {
        periodService.getPeriod(periodId);
        return configurationService.roleWeights(periodId, weekIndex).stream().map(RoleWeightView::from).toList();
    }

    @GetMapping("/validate")
    public ValidationResultView validate(@PathVariable Long periodId,
                                         @RequestParam(defaultValue = "PUBLICATION") ValidationScope scope,
                                         @RequestParam(name = "week", required = false) Integer week) {
        periodService.getPeriod(periodId);
        return ValidationResultView.from(validator.validate(periodId, scope, week));
    }
}
