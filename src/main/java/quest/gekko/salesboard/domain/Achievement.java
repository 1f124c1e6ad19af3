package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One entry of the sales ledger. Written by the logging front end, only read here.
 */
@Entity
@Table(name = "achievement")
@Getter @Setter
public class Achievement {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "shop_id", nullable = false)
    String shopId;

    @Column(name = "user_id", nullable = false)
    String userId;

    @Column(name = "category_id", nullable = false)
    Long categoryId;

    @Column(nullable = false)
    LocalDate occurredOn;

    @Column(name = "achieved_value", nullable = false, precision = 14, scale = 2)
    BigDecimal achievedValue;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    AchievementSource source = AchievementSource.MANUAL;

    @Column(nullable = false)
    Instant createdAt = Instant.now();

    Instant updatedAt;
}
