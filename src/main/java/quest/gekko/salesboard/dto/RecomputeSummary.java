package quest.gekko.salesboard.dto;

import quest.gekko.salesboard.service.allocation.AllocationResult;

import java.util.List;

/**
 * @param unchanged true when the derived set equalled the stored one and nothing was rewritten
 */
public record RecomputeSummary(Long periodId, int targetRows, boolean unchanged, List<AllocationResult.Unallocated> unallocated) {
}
