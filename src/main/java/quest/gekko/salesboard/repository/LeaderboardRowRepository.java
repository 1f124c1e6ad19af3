package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.LeaderboardRow;

import java.util.List;

public interface LeaderboardRowRepository extends JpaRepository<LeaderboardRow, Long> {
    List<LeaderboardRow> findBySnapshotIdOrderByRankAsc(final Long snapshotId);
}
