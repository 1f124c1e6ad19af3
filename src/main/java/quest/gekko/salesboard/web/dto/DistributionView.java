package quest.gekko.salesboard.web.dto;

import quest.gekko.salesboard.domain.WeeklyDistribution;

import java.math.BigDecimal;

public record DistributionView(int weekIndex, BigDecimal percentage) {

    public static DistributionView from(WeeklyDistribution d) {
        return new DistributionView(d.getWeekIndex(), d.getPercentage());
    }
}
