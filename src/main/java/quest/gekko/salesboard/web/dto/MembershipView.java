package quest.gekko.salesboard.web.dto;

import quest.gekko.salesboard.domain.MemberRole;
import quest.gekko.salesboard.domain.ShopMembership;

import java.time.Instant;

public record MembershipView(String shopId, String userId, MemberRole role, boolean active, Instant joinedAt) {

    public static MembershipView from(ShopMembership m) {
        return new MembershipView(m.getShopId(), m.getUserId(), m.getRole(), m.isActive(), m.getJoinedAt());
    }
}
