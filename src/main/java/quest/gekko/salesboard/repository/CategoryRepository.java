package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.Category;

import java.util.List;

public interface CategoryRepository extends JpaRepository<Category, Long> {
    List<Category> findByShopIdOrderBySortOrderAscIdAsc(final String shopId);
}
