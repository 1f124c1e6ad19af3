package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "leaderboard_row", uniqueConstraints = {
        @UniqueConstraint(columnNames = { "snapshot_id", "user_id" }),
        @UniqueConstraint(columnNames = { "snapshot_id", "rank_position" })
})
@Getter @Setter
public class LeaderboardRow {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "snapshot_id", updatable = false)
    LeaderboardSnapshot snapshot;

    @Column(name = "user_id", nullable = false, updatable = false)
    String userId;

    @Column(name = "rank_position", nullable = false, updatable = false)
    Integer rank;

    // achieved total in absolute units, a sum of many 14,2 entries
    @Column(nullable = false, updatable = false, precision = 18, scale = 2)
    BigDecimal score;

    // no upper bound: a one-cent target against a large total goes far past 100
    @Column(nullable = false, updatable = false, precision = 24, scale = 2)
    BigDecimal achievementPct;

    @Enumerated(EnumType.STRING) @Column(nullable = false, updatable = false)
    Trend trend;

    @Column(nullable = false, updatable = false)
    Integer streakDays;
}
