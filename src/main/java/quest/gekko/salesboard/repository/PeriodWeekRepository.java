package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.PeriodWeek;

import java.util.List;

public interface PeriodWeekRepository extends JpaRepository<PeriodWeek, Long> {
    List<PeriodWeek> findByPeriodIdOrderByWeekIndexAsc(final Long periodId);

    boolean existsByPeriodIdAndWeekIndex(final Long periodId, final Integer weekIndex);
}
