package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "weekly_distribution", uniqueConstraints = @UniqueConstraint(columnNames = { "period_id", "week_index" }))
@Getter @Setter
public class WeeklyDistribution {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "period_id", nullable = false)
    Long periodId;

    @Column(name = "week_index", nullable = false)
    Integer weekIndex;

    @Column(nullable = false, precision = 5, scale = 2)
    BigDecimal percentage;
}
