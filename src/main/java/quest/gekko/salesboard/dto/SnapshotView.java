package quest.gekko.salesboard.dto;

import quest.gekko.salesboard.domain.LeaderboardSnapshot;

import java.time.Instant;

public record SnapshotView(Long id, Long periodId, int sequenceNo, String rulesVersion, Instant computedAt) {

    public static SnapshotView from(LeaderboardSnapshot s) {
        return new SnapshotView(s.getId(), s.getPeriodId(), s.getSequenceNo(), s.getRulesVersion(), s.getComputedAt());
    }
}
