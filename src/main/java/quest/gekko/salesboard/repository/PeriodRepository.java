package quest.gekko.salesboard.repository;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import quest.gekko.salesboard.domain.Period;
import quest.gekko.salesboard.domain.PeriodStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PeriodRepository extends JpaRepository<Period, Long> {
    Optional<Period> findByShopIdAndYearAndMonth(final String shopId, final Integer year, final Integer month);

    List<Period> findByShopIdOrderByYearDescMonthDesc(final String shopId);

    List<Period> findByShopIdAndStatusIn(final String shopId, final Collection<PeriodStatus> statuses);

    // Row lock held until commit; backs the in-process period lock across instances
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select p from Period p where p.id = :id")
    Optional<Period> lockById(@Param("id") final Long id);
}
