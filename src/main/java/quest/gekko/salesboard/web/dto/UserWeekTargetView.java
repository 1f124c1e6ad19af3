package quest.gekko.salesboard.web.dto;

import quest.gekko.salesboard.domain.UserWeekTarget;

import java.math.BigDecimal;

public record UserWeekTargetView(int weekIndex, String userId, Long categoryId, BigDecimal targetValue) {

    public static UserWeekTargetView from(UserWeekTarget t) {
        return new UserWeekTargetView(t.getWeekIndex(), t.getUserId(), t.getCategoryId(), t.getTargetValue());
    }
}
