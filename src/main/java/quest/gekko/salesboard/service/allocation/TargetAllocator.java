package quest.gekko.salesboard.service.allocation;

import org.springframework.stereotype.Component;
import quest.gekko.salesboard.domain.MemberRole;
import quest.gekko.salesboard.util.Percentages;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns monthly targets into per-user weekly targets.
 * <p>
 * For each category and week: {@code weekly = M × D / 100}, then for each weighted role
 * {@code role = weekly × R / 100}. Both products are exact. The role targets of one week
 * are then rounded to cents together ({@link CentSplitter#apportion}) so they add up to the
 * weekly target, and each is divided among the role's active members. Weeks with a 0% share
 * and roles with a 0% weight produce no rows.
 */
@Component
public class TargetAllocator {

    private static final Comparator<AllocationResult.Share> ROW_ORDER = Comparator
            .comparingInt(AllocationResult.Share::weekIndex)
            .thenComparingLong(AllocationResult.Share::categoryId)
            .thenComparing(AllocationResult.Share::userId);

    public AllocationResult allocate(AllocationInput input) {
        List<AllocationResult.Share> shares = new ArrayList<>();
        List<AllocationResult.Unallocated> unallocated = new ArrayList<>();

        for (Map.Entry<Long, BigDecimal> category : new TreeMap<>(input.monthlyTargets()).entrySet()) {
            long categoryId = category.getKey();
            for (Integer week : input.weekIndexes().stream().sorted().toList()) {
                BigDecimal pct = input.distribution().getOrDefault(week, BigDecimal.ZERO);
                if (pct.signum() == 0) continue;
                BigDecimal weeklyTarget = Percentages.share(category.getValue(), pct);

                Map<MemberRole, BigDecimal> exactRoleTargets = new TreeMap<>();
                input.roleWeights().getOrDefault(week, Map.of()).forEach((role, weight) -> {
                    if (weight.signum() != 0) exactRoleTargets.put(role, Percentages.share(weeklyTarget, weight));
                });

                for (Map.Entry<MemberRole, BigDecimal> role : CentSplitter.apportion(exactRoleTargets).entrySet()) {
                    List<String> members = input.membersByRole().getOrDefault(role.getKey(), List.of());
                    if (members.isEmpty()) {
                        unallocated.add(new AllocationResult.Unallocated(week, role.getKey(), categoryId, role.getValue()));
                        continue;
                    }
                    CentSplitter.split(role.getValue(), members)
                            .forEach((userId, share) -> shares.add(new AllocationResult.Share(week, userId, categoryId, share)));
                }
            }
        }

        shares.sort(ROW_ORDER);
        return new AllocationResult(List.copyOf(shares), List.copyOf(unallocated));
    }
}
