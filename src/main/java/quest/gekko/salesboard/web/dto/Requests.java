package quest.gekko.salesboard.web.dto;

import quest.gekko.salesboard.domain.CategoryUnit;
import quest.gekko.salesboard.domain.MemberRole;
import quest.gekko.salesboard.domain.PeriodStatus;

/**
 * Request bodies of the HTTP API
 */
public final class Requests {
    private Requests() {}

    public record CreatePeriod(Integer year, Integer month) {}

    public record StatusChange(PeriodStatus status) {}

    public record Membership(MemberRole role, Boolean active) {}

    public record CreateCategory(String name, CategoryUnit unit, Integer sortOrder) {}

    public record ComputeSnapshot(String rulesVersion) {}
}
