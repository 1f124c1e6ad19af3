package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "leaderboard_snapshot", uniqueConstraints = @UniqueConstraint(
        name = LeaderboardSnapshot.SEQUENCE_CONSTRAINT, columnNames = { "period_id", "sequence_no" }))
@Getter @Setter
public class LeaderboardSnapshot {
    public static final String SEQUENCE_CONSTRAINT = "uk_leaderboard_snapshot_sequence";

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "period_id", nullable = false, updatable = false)
    Long periodId;

    // per period, starts at 1
    @Column(name = "sequence_no", nullable = false, updatable = false)
    Integer sequenceNo;

    @Column(nullable = false, updatable = false)
    String rulesVersion;

    @Column(nullable = false, updatable = false)
    Instant computedAt;
}
