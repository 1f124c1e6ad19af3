package quest.gekko.salesboard.service.scoring;

import quest.gekko.salesboard.domain.Trend;

import java.math.BigDecimal;

public record RankedRow(String userId, int rank, BigDecimal score, BigDecimal achievementPct, Trend trend, int streakDays) {
}
