package quest.gekko.salesboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.salesboard.domain.*;
import quest.gekko.salesboard.repository.*;
import quest.gekko.salesboard.service.exception.NotFoundException;
import quest.gekko.salesboard.service.exception.PeriodStateException;
import quest.gekko.salesboard.service.validation.ConfigurationValidator;
import quest.gekko.salesboard.service.validation.ValidationException;
import quest.gekko.salesboard.util.Percentages;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes monthly targets, weekly distribution and role weights. Every write holds the
 * period lock, checks the prospective sums against the 100.00 cap, and marks the period's
 * targets stale in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodConfigurationService {

    public record TargetInput(Long categoryId, BigDecimal targetValue) {}

    public record DistributionInput(Integer weekIndex, BigDecimal percentage) {}

    public record RoleWeightInput(MemberRole role, BigDecimal weightPercentage) {}

    private final PeriodTransactions periodTransactions;
    private final PeriodRepository periodRepository;
    private final PeriodWeekRepository weekRepository;
    private final CategoryRepository categoryRepository;
    private final MonthlyTargetRepository monthlyTargetRepository;
    private final WeeklyDistributionRepository distributionRepository;
    private final WeeklyRoleWeightRepository roleWeightRepository;
    private final ConfigurationValidator validator;
    private final RecalcStateService recalcState;

    public List<MonthlyTarget> upsertMonthlyTargets(Long periodId, List<TargetInput> items) {
        return periodTransactions.execute(periodId, () -> {
            Period period = lockWritable(periodId);
            Set<Long> shopCategories = categoryRepository.findByShopIdOrderBySortOrderAscIdAsc(period.getShopId()).stream()
                    .map(Category::getId)
                    .collect(Collectors.toSet());

            Map<Long, MonthlyTarget> existing = monthlyTargetRepository.findByPeriodIdOrderByCategoryIdAsc(periodId).stream()
                    .collect(Collectors.toMap(MonthlyTarget::getCategoryId, Function.identity()));
            for (TargetInput item : items) {
                String field = "targets[category=" + item.categoryId() + "]";
                if (item.categoryId() == null || !shopCategories.contains(item.categoryId())) {
                    throw ValidationException.of(field, "period=" + periodId, "category does not belong to shop " + period.getShopId());
                }
                if (!Percentages.isValidAmount(item.targetValue())) {
                    throw ValidationException.of(field, "period=" + periodId, "target must be a non-negative amount with at most 2 decimals");
                }
                MonthlyTarget target = existing.computeIfAbsent(item.categoryId(), id -> {
                    MonthlyTarget t = new MonthlyTarget();
                    t.setPeriodId(periodId);
                    t.setCategoryId(id);
                    return t;
                });
                target.setTargetValue(item.targetValue().setScale(2));
            }
            List<MonthlyTarget> saved = monthlyTargetRepository.saveAll(existing.values());
            recalcState.markDirty(periodId, "monthly targets changed");
            return saved.stream().sorted(Comparator.comparing(MonthlyTarget::getCategoryId)).toList();
        });
    }

    public List<WeeklyDistribution> upsertWeeklyDistribution(Long periodId, List<DistributionInput> items) {
        return periodTransactions.execute(periodId, () -> {
            lockWritable(periodId);
            Map<Integer, WeeklyDistribution> byWeek = distributionRepository.findByPeriodIdOrderByWeekIndexAsc(periodId).stream()
                    .collect(Collectors.toMap(WeeklyDistribution::getWeekIndex, Function.identity(), (a, b) -> b, TreeMap::new));

            for (DistributionInput item : items) {
                String field = "weekly_distribution[week=" + item.weekIndex() + "]";
                requireWeek(periodId, item.weekIndex(), field);
                if (!Percentages.isValidPercentage(item.percentage())) {
                    throw ValidationException.of(field, "period=" + periodId, "percentage must be between 0 and 100 with at most 2 decimals");
                }
                WeeklyDistribution row = byWeek.computeIfAbsent(item.weekIndex(), week -> {
                    WeeklyDistribution d = new WeeklyDistribution();
                    d.setPeriodId(periodId);
                    d.setWeekIndex(week);
                    return d;
                });
                row.setPercentage(item.percentage().setScale(2));
            }

            validator.checkDistributionCap(periodId, byWeek.values().stream().map(WeeklyDistribution::getPercentage).toList())
                    .orThrow();
            List<WeeklyDistribution> saved = distributionRepository.saveAll(byWeek.values());
            recalcState.markDirty(periodId, "weekly distribution changed");
            return saved;
        });
    }

    public List<WeeklyRoleWeight> upsertRoleWeights(Long periodId, int weekIndex, List<RoleWeightInput> items) {
        return periodTransactions.execute(periodId, () -> {
            lockWritable(periodId);
            requireWeek(periodId, weekIndex, ConfigurationValidator.roleWeightField(weekIndex));
            Map<MemberRole, WeeklyRoleWeight> byRole = roleWeightRepository.findByPeriodIdAndWeekIndexOrderByRoleAsc(periodId, weekIndex).stream()
                    .collect(Collectors.toMap(WeeklyRoleWeight::getRole, Function.identity(), (a, b) -> b, () -> new EnumMap<>(MemberRole.class)));

            for (RoleWeightInput item : items) {
                String field = ConfigurationValidator.roleWeightField(weekIndex) + "[" + item.role() + "]";
                if (item.role() == null) {
                    throw ValidationException.of(field, "period=" + periodId, "role is required");
                }
                if (!Percentages.isValidPercentage(item.weightPercentage())) {
                    throw ValidationException.of(field, "period=" + periodId, "weight must be between 0 and 100 with at most 2 decimals");
                }
                WeeklyRoleWeight row = byRole.computeIfAbsent(item.role(), role -> {
                    WeeklyRoleWeight w = new WeeklyRoleWeight();
                    w.setPeriodId(periodId);
                    w.setWeekIndex(weekIndex);
                    w.setRole(role);
                    return w;
                });
                row.setWeightPercentage(item.weightPercentage().setScale(2));
            }

            Map<MemberRole, BigDecimal> proposed = new EnumMap<>(MemberRole.class);
            byRole.forEach((role, row) -> proposed.put(role, row.getWeightPercentage()));
            validator.checkRoleWeightCap(periodId, weekIndex, proposed).orThrow();

            List<WeeklyRoleWeight> saved = roleWeightRepository.saveAll(byRole.values());
            recalcState.markDirty(periodId, "role weights of week " + weekIndex + " changed");
            return saved;
        });
    }

    @Transactional(readOnly = true)
    public List<MonthlyTarget> monthlyTargets(Long periodId) {
        return monthlyTargetRepository.findByPeriodIdOrderByCategoryIdAsc(periodId);
    }

    @Transactional(readOnly = true)
    public List<WeeklyDistribution> weeklyDistribution(Long periodId) {
        return distributionRepository.findByPeriodIdOrderByWeekIndexAsc(periodId);
    }

    @Transactional(readOnly = true)
    public List<WeeklyRoleWeight> roleWeights(Long periodId, int weekIndex) {
        return roleWeightRepository.findByPeriodIdAndWeekIndexOrderByRoleAsc(periodId, weekIndex);
    }

    private Period lockWritable(Long periodId) {
        Period period = periodRepository.lockById(periodId)
                .orElseThrow(() -> new NotFoundException("Period", periodId));
        if (period.isFrozen()) {
            log.warn("Rejected configuration write to {} period {}", period.getStatus(), periodId);
            throw PeriodStateException.frozen(periodId, period.getStatus());
        }
        return period;
    }

    private void requireWeek(Long periodId, Integer weekIndex, String field) {
        if (weekIndex == null || !weekRepository.existsByPeriodIdAndWeekIndex(periodId, weekIndex)) {
            throw ValidationException.of(field, "period=" + periodId, "week " + weekIndex + " does not exist in this period");
        }
    }
}
