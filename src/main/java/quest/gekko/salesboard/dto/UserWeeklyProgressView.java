package quest.gekko.salesboard.dto;

import java.math.BigDecimal;
import java.util.List;

public record UserWeeklyProgressView(String userId, List<CategoryProgressView> categories,
                                     BigDecimal totalTarget, BigDecimal totalAchieved, BigDecimal achievementPct) {
}
