package quest.gekko.salesboard.dto;

import quest.gekko.salesboard.domain.CategoryUnit;

import java.math.BigDecimal;

public record CategoryPerformanceView(Long categoryId, String name, CategoryUnit unit,
                                      BigDecimal target, BigDecimal achieved, BigDecimal achievementPct) {
}
