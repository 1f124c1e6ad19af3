package quest.gekko.salesboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.salesboard.domain.ShopMembership;

import java.util.List;
import java.util.Optional;

public interface ShopMembershipRepository extends JpaRepository<ShopMembership, Long> {
    List<ShopMembership> findByShopIdAndActiveTrueOrderByUserIdAsc(final String shopId);

    List<ShopMembership> findByShopId(final String shopId);

    Optional<ShopMembership> findByShopIdAndUserId(final String shopId, final String userId);
}
