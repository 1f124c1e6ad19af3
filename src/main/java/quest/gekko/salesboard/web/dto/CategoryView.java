package quest.gekko.salesboard.web.dto;

import quest.gekko.salesboard.domain.Category;
import quest.gekko.salesboard.domain.CategoryUnit;

public record CategoryView(Long id, String shopId, String name, CategoryUnit unit, Integer sortOrder) {

    public static CategoryView from(Category c) {
        return new CategoryView(c.getId(), c.getShopId(), c.getName(), c.getUnit(), c.getSortOrder());
    }
}
