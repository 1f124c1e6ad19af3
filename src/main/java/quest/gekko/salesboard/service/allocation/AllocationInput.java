package quest.gekko.salesboard.service.allocation;

import quest.gekko.salesboard.domain.MemberRole;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Everything a recompute reads, detached from persistence.
 *
 * @param weekIndexes    the weeks of the period
 * @param distribution   week index to percentage of the monthly target; missing weeks count as 0
 * @param roleWeights    week index to role to percentage of that week's target
 * @param monthlyTargets category id to monthly target
 * @param membersByRole  active members per role
 */
public record AllocationInput(Long periodId,
                              List<Integer> weekIndexes,
                              Map<Integer, BigDecimal> distribution,
                              Map<Integer, Map<MemberRole, BigDecimal>> roleWeights,
                              Map<Long, BigDecimal> monthlyTargets,
                              Map<MemberRole, List<String>> membersByRole) {
}
