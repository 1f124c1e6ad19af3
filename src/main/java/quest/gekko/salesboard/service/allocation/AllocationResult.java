package quest.gekko.salesboard.service.allocation;

import quest.gekko.salesboard.domain.MemberRole;

import java.math.BigDecimal;
import java.util.List;

public record AllocationResult(List<Share> shares, List<Unallocated> unallocated) {

    public record Share(int weekIndex, String userId, long categoryId, BigDecimal targetValue) {}

    /** A weighted role with nobody to carry its part of the week. */
    public record Unallocated(int weekIndex, MemberRole role, long categoryId, BigDecimal amount) {}
}
