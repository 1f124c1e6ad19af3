package quest.gekko.salesboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.salesboard.domain.*;
import quest.gekko.salesboard.dto.RecomputeSummary;
import quest.gekko.salesboard.repository.*;
import quest.gekko.salesboard.service.allocation.AllocationInput;
import quest.gekko.salesboard.service.allocation.AllocationResult;
import quest.gekko.salesboard.service.allocation.TargetAllocator;
import quest.gekko.salesboard.service.exception.NotFoundException;
import quest.gekko.salesboard.service.exception.RecomputeException;
import quest.gekko.salesboard.service.validation.ConfigurationValidator;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Derives the {@link UserWeekTarget} rows of a period. A recompute holds the period lock,
 * runs in one transaction and either replaces every row of the period or leaves the
 * previous set in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TargetAllocationService {
    private final PeriodTransactions periodTransactions;
    private final PeriodRepository periodRepository;
    private final PeriodWeekRepository weekRepository;
    private final MonthlyTargetRepository monthlyTargetRepository;
    private final WeeklyDistributionRepository distributionRepository;
    private final WeeklyRoleWeightRepository roleWeightRepository;
    private final ShopMembershipRepository membershipRepository;
    private final UserWeekTargetRepository targetRepository;
    private final ConfigurationValidator validator;
    private final RecalcStateService recalcState;
    private final TargetAllocator allocator;

    public RecomputeSummary recompute(Long periodId) {
        try {
            return periodTransactions.execute(periodId, () -> replaceTargets(periodId));
        } catch (DataAccessException e) {
            throw new RecomputeException(periodId, "storage failure: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<UserWeekTarget> targets(Long periodId) {
        return targetRepository.findByPeriodIdOrderByWeekIndexAscCategoryIdAscUserIdAsc(periodId);
    }

    private RecomputeSummary replaceTargets(Long periodId) {
        Period period = periodRepository.lockById(periodId)
                .orElseThrow(() -> new NotFoundException("Period", periodId));
        if (period.isFrozen()) {
            throw new RecomputeException(periodId, "period is " + period.getStatus());
        }
        List<PeriodWeek> weeks = weekRepository.findByPeriodIdOrderByWeekIndexAsc(periodId);
        if (weeks.isEmpty()) {
            throw new RecomputeException(periodId, "no weeks defined");
        }
        validator.validateWithinBounds(periodId).orThrow();

        AllocationResult result = allocator.allocate(readInput(period, weeks));
        for (AllocationResult.Unallocated u : result.unallocated()) {
            log.warn("Period {} week {} category {}: no active {} members, {} left unallocated",
                    periodId, u.weekIndex(), u.categoryId(), u.role(), u.amount().toPlainString());
        }

        List<UserWeekTarget> existing = targetRepository.findByPeriodIdOrderByWeekIndexAscCategoryIdAscUserIdAsc(periodId);
        boolean unchanged = sameRows(existing, result.shares());
        if (!unchanged) {
            targetRepository.deleteAllForPeriod(periodId);
            targetRepository.saveAll(result.shares().stream().map(s -> toEntity(periodId, s)).toList());
        }
        recalcState.markClean(periodId);

        log.info("Recomputed period {} ({} {}): {} target rows{}", periodId, period.getShopId(), period.yearMonth(),
                result.shares().size(), unchanged ? ", unchanged" : "");
        return new RecomputeSummary(periodId, result.shares().size(), unchanged, result.unallocated());
    }

    private AllocationInput readInput(Period period, List<PeriodWeek> weeks) {
        Long periodId = period.getId();
        Map<Integer, BigDecimal> distribution = distributionRepository.findByPeriodIdOrderByWeekIndexAsc(periodId).stream()
                .collect(Collectors.toMap(WeeklyDistribution::getWeekIndex, WeeklyDistribution::getPercentage));

        Map<Integer, Map<MemberRole, BigDecimal>> roleWeights = new HashMap<>();
        for (WeeklyRoleWeight w : roleWeightRepository.findByPeriodIdOrderByWeekIndexAscRoleAsc(periodId)) {
            roleWeights.computeIfAbsent(w.getWeekIndex(), k -> new EnumMap<>(MemberRole.class)).put(w.getRole(), w.getWeightPercentage());
        }

        Map<Long, BigDecimal> monthlyTargets = monthlyTargetRepository.findByPeriodIdOrderByCategoryIdAsc(periodId).stream()
                .collect(Collectors.toMap(MonthlyTarget::getCategoryId, MonthlyTarget::getTargetValue));

        Map<MemberRole, List<String>> membersByRole = membershipRepository.findByShopIdAndActiveTrueOrderByUserIdAsc(period.getShopId()).stream()
                .collect(Collectors.groupingBy(ShopMembership::getRole, () -> new EnumMap<>(MemberRole.class),
                        Collectors.mapping(ShopMembership::getUserId, Collectors.toList())));

        return new AllocationInput(periodId, weeks.stream().map(PeriodWeek::getWeekIndex).toList(),
                distribution, roleWeights, monthlyTargets, membersByRole);
    }

    private static boolean sameRows(List<UserWeekTarget> existing, List<AllocationResult.Share> computed) {
        if (existing.size() != computed.size()) return false;
        Set<AllocationResult.Share> stored = existing.stream()
                .map(t -> new AllocationResult.Share(t.getWeekIndex(), t.getUserId(), t.getCategoryId(), t.getTargetValue().setScale(2)))
                .collect(Collectors.toSet());
        return stored.containsAll(computed);
    }

    private static UserWeekTarget toEntity(Long periodId, AllocationResult.Share share) {
        UserWeekTarget target = new UserWeekTarget();
        target.setPeriodId(periodId);
        target.setWeekIndex(share.weekIndex());
        target.setUserId(share.userId());
        target.setCategoryId(share.categoryId());
        target.setTargetValue(share.targetValue());
        return target;
    }
}
