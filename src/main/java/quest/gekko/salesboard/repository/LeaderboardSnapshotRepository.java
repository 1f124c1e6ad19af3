package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.LeaderboardSnapshot;

import java.util.List;
import java.util.Optional;

public interface LeaderboardSnapshotRepository extends JpaRepository<LeaderboardSnapshot, Long> {
    List<LeaderboardSnapshot> findByPeriodIdOrderByComputedAtDescSequenceNoDesc(final Long periodId);

    Optional<LeaderboardSnapshot> findFirstByPeriodIdOrderByComputedAtDescSequenceNoDesc(final Long periodId);

    Optional<LeaderboardSnapshot> findFirstByPeriodIdOrderBySequenceNoDesc(final Long periodId);
}
