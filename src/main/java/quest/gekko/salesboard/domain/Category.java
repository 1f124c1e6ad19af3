package quest.gekko.salesboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "category")
@Getter @Setter
public class Category {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "shop_id", nullable = false)
    String shopId;

    @Column(nullable = false)
    String name;

    // presentational only, never changes the arithmetic
    @Enumerated(EnumType.STRING) @Column(nullable = false)
    CategoryUnit unit = CategoryUnit.COUNT;

    Integer sortOrder;
}
