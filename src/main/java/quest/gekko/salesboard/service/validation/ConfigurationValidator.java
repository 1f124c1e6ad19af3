package quest.gekko.salesboard.service.validation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import quest.gekko.salesboard.domain.MemberRole;
import quest.gekko.salesboard.domain.PeriodWeek;
import quest.gekko.salesboard.domain.WeeklyDistribution;
import quest.gekko.salesboard.domain.WeeklyRoleWeight;
import quest.gekko.salesboard.repository.PeriodWeekRepository;
import quest.gekko.salesboard.repository.WeeklyDistributionRepository;
import quest.gekko.salesboard.repository.WeeklyRoleWeightRepository;
import quest.gekko.salesboard.util.Percentages;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Checks the percentage splits of a period.
 * <p>
 * Two rules apply. While a period is being edited every split may sum to at most 100.00,
 * so a draft can legitimately sit below 100. Publishing or locking requires the weekly
 * distribution and the role weights of each week to sum to exactly 100.00 within
 * {@link Percentages#TOLERANCE}. Failures are reported, never corrected.
 */
@Service
@RequiredArgsConstructor
public class ConfigurationValidator {

    public static final String DISTRIBUTION_FIELD = "weekly_distribution";

    private final PeriodWeekRepository weekRepository;
    private final WeeklyDistributionRepository distributionRepository;
    private final WeeklyRoleWeightRepository roleWeightRepository;

    public ValidationReport validate(Long periodId, ValidationScope scope, Integer weekIndex) {
        return switch (scope) {
            case DISTRIBUTION -> validateDistribution(periodId);
            case ROLE_WEIGHTS -> weekIndex != null
                    ? validateRoleWeights(periodId, weekIndex)
                    : validateAllRoleWeights(periodId);
            case PUBLICATION -> validateForPublication(periodId);
        };
    }

    public ValidationReport validateDistribution(Long periodId) {
        return checkDistributionCap(periodId, distributionRepository.findByPeriodIdOrderByWeekIndexAsc(periodId).stream()
                .map(WeeklyDistribution::getPercentage)
                .toList());
    }

    public ValidationReport validateRoleWeights(Long periodId, int weekIndex) {
        Map<MemberRole, BigDecimal> weights = roleWeightRepository.findByPeriodIdAndWeekIndexOrderByRoleAsc(periodId, weekIndex).stream()
                .collect(Collectors.toMap(WeeklyRoleWeight::getRole, WeeklyRoleWeight::getWeightPercentage, (a, b) -> b, TreeMap::new));
        return checkRoleWeightCap(periodId, weekIndex, weights);
    }

    /** The write-time rule over the whole period; a recompute refuses to run without it. */
    public ValidationReport validateWithinBounds(Long periodId) {
        return validateDistribution(periodId).and(validateAllRoleWeights(periodId));
    }

    public ValidationReport validateForPublication(Long periodId) {
        List<PeriodWeek> weeks = weekRepository.findByPeriodIdOrderByWeekIndexAsc(periodId);
        List<Violation> violations = new ArrayList<>();

        BigDecimal distributionSum = Percentages.sum(distributionRepository.findByPeriodIdOrderByWeekIndexAsc(periodId).stream()
                .map(WeeklyDistribution::getPercentage)
                .toList());
        if (!Percentages.complete(distributionSum)) {
            violations.add(new Violation(DISTRIBUTION_FIELD, "period=" + periodId, distributionSum,
                    "weekly distribution must sum to 100.00 before publishing, found " + distributionSum.toPlainString()));
        }

        Map<Integer, Map<MemberRole, BigDecimal>> weightsByWeek = roleWeightsByWeek(periodId);
        for (PeriodWeek week : weeks) {
            Map<MemberRole, BigDecimal> weights = weightsByWeek.getOrDefault(week.getWeekIndex(), Map.of());
            BigDecimal sum = Percentages.sum(weights.values());
            if (!Percentages.complete(sum)) {
                violations.add(new Violation(roleWeightField(week.getWeekIndex()), roleScope(periodId, week.getWeekIndex(), weights.keySet()), sum,
                        "role weights of week " + week.getWeekIndex() + " must sum to 100.00 before publishing, found " + sum.toPlainString()));
            }
        }
        return new ValidationReport(List.copyOf(violations));
    }

    /** Sum the proposed distribution would have once written. */
    public ValidationReport checkDistributionCap(Long periodId, Collection<BigDecimal> percentages) {
        BigDecimal sum = Percentages.sum(percentages);
        if (Percentages.withinCap(sum)) return ValidationReport.ok();
        return new ValidationReport(List.of(new Violation(DISTRIBUTION_FIELD, "period=" + periodId, sum,
                "weekly distribution may not exceed 100.00, would be " + sum.toPlainString())));
    }

    public ValidationReport checkRoleWeightCap(Long periodId, int weekIndex, Map<MemberRole, BigDecimal> weights) {
        BigDecimal sum = Percentages.sum(weights.values());
        if (Percentages.withinCap(sum)) return ValidationReport.ok();
        return new ValidationReport(List.of(new Violation(roleWeightField(weekIndex), roleScope(periodId, weekIndex, weights.keySet()), sum,
                "role weights of week " + weekIndex + " may not exceed 100.00, would be " + sum.toPlainString())));
    }

    private ValidationReport validateAllRoleWeights(Long periodId) {
        ValidationReport report = ValidationReport.ok();
        for (Map.Entry<Integer, Map<MemberRole, BigDecimal>> e : roleWeightsByWeek(periodId).entrySet()) {
            report = report.and(checkRoleWeightCap(periodId, e.getKey(), e.getValue()));
        }
        return report;
    }

    private Map<Integer, Map<MemberRole, BigDecimal>> roleWeightsByWeek(Long periodId) {
        Map<Integer, Map<MemberRole, BigDecimal>> byWeek = new TreeMap<>();
        for (WeeklyRoleWeight w : roleWeightRepository.findByPeriodIdOrderByWeekIndexAscRoleAsc(periodId)) {
            byWeek.computeIfAbsent(w.getWeekIndex(), k -> new TreeMap<>()).put(w.getRole(), w.getWeightPercentage());
        }
        return byWeek;
    }

    public static String roleWeightField(int weekIndex) {
        return "role_weights[week=" + weekIndex + "]";
    }

    private static String roleScope(Long periodId, int weekIndex, Collection<MemberRole> roles) {
        return "period=" + periodId + ",week=" + weekIndex + ",roles=" + roles;
    }
}
