package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.WeeklyDistribution;

import java.util.List;

public interface WeeklyDistributionRepository extends JpaRepository<WeeklyDistribution, Long> {
    List<WeeklyDistribution> findByPeriodIdOrderByWeekIndexAsc(final Long periodId);
}
