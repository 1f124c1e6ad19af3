package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Entity
@Table(name = "period_week", uniqueConstraints = @UniqueConstraint(columnNames = { "period_id", "week_index" }))
@Getter @Setter
public class PeriodWeek {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "period_id", nullable = false)
    Long periodId;

    // 1-based
    @Column(name = "week_index", nullable = false)
    Integer weekIndex;

    @Column(nullable = false)
    LocalDate startDate;

    @Column(nullable = false)
    LocalDate endDate;

    @Column(nullable = false)
    Integer dayCount;

    public boolean contains(LocalDate day) {
        return !day.isBefore(startDate) && !day.isAfter(endDate);
    }
}
