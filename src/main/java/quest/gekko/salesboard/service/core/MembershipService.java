package quest.gekko.salesboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.salesboard.domain.MemberRole;
import quest.gekko.salesboard.domain.Period;
import quest.gekko.salesboard.domain.PeriodStatus;
import quest.gekko.salesboard.domain.ShopMembership;
import quest.gekko.salesboard.repository.PeriodRepository;
import quest.gekko.salesboard.repository.ShopMembershipRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Applies membership changes coming from the invitation flow. Role and active flag feed
 * straight into allocation, so every open period of the shop goes stale with the change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipService {
    private final ShopMembershipRepository membershipRepository;
    private final PeriodRepository periodRepository;
    private final PeriodTransactions periodTransactions;
    private final RecalcStateService recalcState;
    private final Clock clock;

    public ShopMembership upsertMembership(String shopId, String userId, MemberRole role, boolean active) {
        List<Long> openPeriods = periodRepository.findByShopIdAndStatusIn(shopId, EnumSet.of(PeriodStatus.DRAFT, PeriodStatus.PUBLISHED)).stream()
                .map(Period::getId)
                .toList();

        // Holding every open period's lock keeps a running recompute from clearing the flag we set here
        return periodTransactions.execute(openPeriods, () -> {
            ShopMembership membership = membershipRepository.findByShopIdAndUserId(shopId, userId)
                    .orElseGet(() -> {
                        ShopMembership m = new ShopMembership();
                        m.setShopId(shopId);
                        m.setUserId(userId);
                        m.setJoinedAt(Instant.now(clock));
                        return m;
                    });
            boolean changed = membership.getId() == null || membership.getRole() != role || membership.isActive() != active;
            membership.setRole(role);
            membership.setActive(active);
            ShopMembership saved = membershipRepository.save(membership);

            if (changed) {
                String reason = "membership of " + userId + " changed (" + role + (active ? ", active)" : ", inactive)");
                openPeriods.forEach(periodId -> recalcState.markDirty(periodId, reason));
                log.info("Membership {} in shop {} -> {} active={}, {} open period(s) marked dirty",
                        userId, shopId, role, active, openPeriods.size());
            }
            return saved;
        });
    }

    public List<ShopMembership> members(String shopId) {
        return membershipRepository.findByShopId(shopId);
    }
}
