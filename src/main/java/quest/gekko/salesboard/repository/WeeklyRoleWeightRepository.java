package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.WeeklyRoleWeight;

import java.util.List;

public interface WeeklyRoleWeightRepository extends JpaRepository<WeeklyRoleWeight, Long> {
    List<WeeklyRoleWeight> findByPeriodIdOrderByWeekIndexAscRoleAsc(final Long periodId);

    List<WeeklyRoleWeight> findByPeriodIdAndWeekIndexOrderByRoleAsc(final Long periodId, final Integer weekIndex);
}
