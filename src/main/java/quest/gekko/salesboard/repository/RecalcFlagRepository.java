package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.RecalcFlag;

import java.util.List;

public interface RecalcFlagRepository extends JpaRepository<RecalcFlag, Long> {
    List<RecalcFlag> findByDirtyTrueOrderByUpdatedAtAsc();
}
