package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "shop_membership", uniqueConstraints = @UniqueConstraint(columnNames = { "shop_id", "user_id" }))
@Getter @Setter
public class ShopMembership {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "shop_id", nullable = false)
    String shopId;

    @Column(name = "user_id", nullable = false)
    String userId;

    @Enumerated(EnumType.STRING) @Column(name = "member_role", nullable = false)
    MemberRole role;

    @Column(nullable = false)
    boolean active = true;

    @Column(nullable = false)
    Instant joinedAt = Instant.now();
}
