package quest.gekko.salesboard.dto;

import java.math.BigDecimal;

public record CategoryProgressView(Long categoryId, BigDecimal target, BigDecimal achieved) {
}
