package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.Achievement;

import java.time.LocalDate;
import java.util.List;

public interface AchievementRepository extends JpaRepository<Achievement, Long> {
    // both bounds inclusive
    List<Achievement> findByShopIdAndOccurredOnBetweenOrderByOccurredOnAsc(final String shopId, final LocalDate from, final LocalDate to);
}
