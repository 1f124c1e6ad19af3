package quest.gekko.salesboard.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.salesboard.domain.*;
import quest.gekko.salesboard.dto.CategoryPerformanceView;
import quest.gekko.salesboard.dto.CategoryProgressView;
import quest.gekko.salesboard.dto.UserWeeklyProgressView;
import quest.gekko.salesboard.dto.WeeklyProgressView;
import quest.gekko.salesboard.repository.*;
import quest.gekko.salesboard.service.exception.NotFoundException;
import quest.gekko.salesboard.util.Percentages;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-only target vs. achieved views for dashboards. Targets come from the last recompute,
 * so a dirty period shows its previous targets.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProgressService {
    private final PeriodRepository periodRepository;
    private final PeriodWeekRepository weekRepository;
    private final CategoryRepository categoryRepository;
    private final MonthlyTargetRepository monthlyTargetRepository;
    private final UserWeekTargetRepository targetRepository;
    private final AchievementRepository achievementRepository;

    public List<CategoryPerformanceView> categoryPerformance(Long periodId) {
        Period period = period(periodId);
        Map<Long, BigDecimal> targets = monthlyTargetRepository.findByPeriodIdOrderByCategoryIdAsc(periodId).stream()
                .collect(Collectors.toMap(MonthlyTarget::getCategoryId, MonthlyTarget::getTargetValue));
        Map<Long, BigDecimal> achieved = achievements(period).stream()
                .collect(Collectors.groupingBy(Achievement::getCategoryId,
                        Collectors.reducing(BigDecimal.ZERO, Achievement::getAchievedValue, BigDecimal::add)));

        List<CategoryPerformanceView> result = new ArrayList<>();
        for (Category c : categoryRepository.findByShopIdOrderBySortOrderAscIdAsc(period.getShopId())) {
            BigDecimal target = targets.getOrDefault(c.getId(), BigDecimal.ZERO).setScale(2);
            BigDecimal done = achieved.getOrDefault(c.getId(), BigDecimal.ZERO).setScale(2);
            result.add(new CategoryPerformanceView(c.getId(), c.getName(), c.getUnit(), target, done, Percentages.ratio(done, target)));
        }
        return result;
    }

    public List<WeeklyProgressView> weeklyProgress(Long periodId) {
        Period period = period(periodId);
        List<PeriodWeek> weeks = weekRepository.findByPeriodIdOrderByWeekIndexAsc(periodId);
        List<UserWeekTarget> targets = targetRepository.findByPeriodIdOrderByWeekIndexAscCategoryIdAscUserIdAsc(periodId);
        List<Achievement> achievements = achievements(period);

        List<WeeklyProgressView> result = new ArrayList<>(weeks.size());
        for (PeriodWeek week : weeks) {
            // user -> category -> target
            Map<String, Map<Long, BigDecimal>> weekTargets = new TreeMap<>();
            targets.stream()
                    .filter(t -> t.getWeekIndex().equals(week.getWeekIndex()))
                    .forEach(t -> weekTargets.computeIfAbsent(t.getUserId(), k -> new TreeMap<>()).put(t.getCategoryId(), t.getTargetValue()));

            Map<String, Map<Long, BigDecimal>> weekAchieved = new HashMap<>();
            achievements.stream()
                    .filter(a -> week.contains(a.getOccurredOn()))
                    .forEach(a -> weekAchieved.computeIfAbsent(a.getUserId(), k -> new HashMap<>())
                            .merge(a.getCategoryId(), a.getAchievedValue(), BigDecimal::add));

            List<UserWeeklyProgressView> users = new ArrayList<>();
            weekTargets.forEach((userId, byCategory) -> {
                Map<Long, BigDecimal> done = weekAchieved.getOrDefault(userId, Map.of());
                List<CategoryProgressView> categories = new ArrayList<>();
                BigDecimal totalTarget = BigDecimal.ZERO.setScale(2);
                BigDecimal totalAchieved = BigDecimal.ZERO.setScale(2);
                for (Map.Entry<Long, BigDecimal> e : byCategory.entrySet()) {
                    BigDecimal achieved = done.getOrDefault(e.getKey(), BigDecimal.ZERO).setScale(2);
                    categories.add(new CategoryProgressView(e.getKey(), e.getValue(), achieved));
                    totalTarget = totalTarget.add(e.getValue());
                    totalAchieved = totalAchieved.add(achieved);
                }
                users.add(new UserWeeklyProgressView(userId, categories, totalTarget, totalAchieved,
                        Percentages.ratio(totalAchieved, totalTarget)));
            });
            result.add(new WeeklyProgressView(week.getWeekIndex(), week.getStartDate(), week.getEndDate(), users));
        }
        return result;
    }

    private Period period(Long periodId) {
        return periodRepository.findById(periodId)
                .orElseThrow(() -> new NotFoundException("Period", periodId));
    }

    private List<Achievement> achievements(Period period) {
        return achievementRepository.findByShopIdAndOccurredOnBetweenOrderByOccurredOnAsc(period.getShopId(), period.firstDay(), period.lastDay());
    }
}
