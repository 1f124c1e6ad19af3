package quest.gekko.salesboard.dto;

import quest.gekko.salesboard.domain.RecalcFlag;

import java.time.Instant;

public record RecalcStateView(Long periodId, boolean dirty, String reason, Instant updatedAt, Instant lastRecomputedAt) {

    public static RecalcStateView from(RecalcFlag flag) {
        return new RecalcStateView(flag.getPeriodId(), flag.isDirty(), flag.getReason(),
                flag.getUpdatedAt(), flag.getLastRecomputedAt());
    }
}
