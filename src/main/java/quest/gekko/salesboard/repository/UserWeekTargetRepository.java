package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.salesboard.domain.UserWeekTarget;

import java.util.List;

public interface UserWeekTargetRepository extends JpaRepository<UserWeekTarget, Long> {
    List<UserWeekTarget> findByPeriodIdOrderByWeekIndexAscCategoryIdAscUserIdAsc(final Long periodId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from UserWeekTarget t where t.periodId = :periodId")
    int deleteAllForPeriod(@Param("periodId") final Long periodId);
}
