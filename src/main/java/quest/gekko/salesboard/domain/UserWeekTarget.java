package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Derived per-user target for one week and category. Rows of a period are only ever
 * replaced as a whole by a recompute.
 */
@Entity
@Table(name = "user_week_target",
        uniqueConstraints = @UniqueConstraint(columnNames = { "period_id", "week_index", "user_id", "category_id" }))
@Getter @Setter
public class UserWeekTarget {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "period_id", nullable = false)
    Long periodId;

    @Column(name = "week_index", nullable = false)
    Integer weekIndex;

    @Column(name = "user_id", nullable = false)
    String userId;

    @Column(name = "category_id", nullable = false)
    Long categoryId;

    @Column(name = "target_value", nullable = false, precision = 14, scale = 2)
    BigDecimal targetValue;
}
