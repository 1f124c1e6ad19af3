package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "weekly_role_weight", uniqueConstraints = @UniqueConstraint(columnNames = { "period_id", "week_index", "member_role" }))
@Getter @Setter
public class WeeklyRoleWeight {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "period_id", nullable = false)
    Long periodId;

    @Column(name = "week_index", nullable = false)
    Integer weekIndex;

    @Enumerated(EnumType.STRING) @Column(name = "member_role", nullable = false)
    MemberRole role;

    @Column(nullable = false, precision = 5, scale = 2)
    BigDecimal weightPercentage;
}
