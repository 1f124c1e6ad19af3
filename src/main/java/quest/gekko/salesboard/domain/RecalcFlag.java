package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "recalc_flag")
@Getter @Setter
public class RecalcFlag {
    @Id
    @Column(name = "period_id")
    Long periodId;

    @Column(nullable = false)
    boolean dirty;

    String reason;

    @Column(nullable = false)
    Instant updatedAt;

    Instant lastRecomputedAt;
}
