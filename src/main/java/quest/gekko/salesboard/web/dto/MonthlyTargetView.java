package quest.gekko.salesboard.web.dto;

import quest.gekko.salesboard.domain.MonthlyTarget;

import java.math.BigDecimal;

public record MonthlyTargetView(Long categoryId, BigDecimal targetValue) {

    public static MonthlyTargetView from(MonthlyTarget t) {
        return new MonthlyTargetView(t.getCategoryId(), t.getTargetValue());
    }
}
