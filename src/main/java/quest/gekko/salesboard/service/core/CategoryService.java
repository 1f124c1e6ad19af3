package quest.gekko.salesboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.salesboard.domain.Category;
import quest.gekko.salesboard.domain.CategoryUnit;
import quest.gekko.salesboard.repository.CategoryRepository;
import quest.gekko.salesboard.service.validation.ValidationException;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryService {
    private final CategoryRepository categoryRepository;

    @Transactional
    public Category createCategory(String shopId, String name, CategoryUnit unit, Integer sortOrder) {
        if (name == null || name.isBlank()) {
            throw ValidationException.of("name", "shop=" + shopId, "category name is required");
        }
        Category category = new Category();
        category.setShopId(shopId);
        category.setName(name.trim());
        category.setUnit(unit == null ? CategoryUnit.COUNT : unit);
        category.setSortOrder(sortOrder);
        Category saved = categoryRepository.save(category);
        log.info("Created category {} '{}' for shop {}", saved.getId(), saved.getName(), shopId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Category> categories(String shopId) {
        return categoryRepository.findByShopIdOrderBySortOrderAscIdAsc(shopId);
    }
}
