package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.MonthlyTarget;

import java.util.List;
import java.util.Optional;

public interface MonthlyTargetRepository extends JpaRepository<MonthlyTarget, Long> {
    List<MonthlyTarget> findByPeriodIdOrderByCategoryIdAsc(final Long periodId);

    Optional<MonthlyTarget> findByPeriodIdAndCategoryId(final Long periodId, final Long categoryId);
}
