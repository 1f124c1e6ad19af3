package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;

@Entity
@Table(name = "period", uniqueConstraints = @UniqueConstraint(columnNames = { "shop_id", "period_year", "period_month" }))
@Getter @Setter
public class Period {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "shop_id", nullable = false)
    String shopId;

    @Column(name = "period_year", nullable = false)
    Integer year;

    @Column(name = "period_month", nullable = false)
    Integer month;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    PeriodStatus status = PeriodStatus.DRAFT;

    @Column(nullable = false)
    Instant createdAt = Instant.now();

    public YearMonth yearMonth() {
        return YearMonth.of(year, month);
    }

    public LocalDate firstDay() {
        return yearMonth().atDay(1);
    }

    public LocalDate lastDay() {
        return yearMonth().atEndOfMonth();
    }

    public boolean isFrozen() {
        return status.isFrozen();
    }
}
