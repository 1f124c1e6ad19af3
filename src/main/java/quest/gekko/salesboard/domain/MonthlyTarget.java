package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "monthly_target", uniqueConstraints = @UniqueConstraint(columnNames = { "period_id", "category_id" }))
@Getter @Setter
public class MonthlyTarget {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "period_id", nullable = false)
    Long periodId;

    @Column(name = "category_id", nullable = false)
    Long categoryId;

    @Column(name = "target_value", nullable = false, precision = 14, scale = 2)
    BigDecimal targetValue;
}
