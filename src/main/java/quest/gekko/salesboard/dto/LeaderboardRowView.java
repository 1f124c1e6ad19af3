package quest.gekko.salesboard.dto;

import quest.gekko.salesboard.domain.LeaderboardRow;
import quest.gekko.salesboard.domain.Trend;

import java.math.BigDecimal;

public record LeaderboardRowView(String userId, int rank, BigDecimal score, BigDecimal achievementPct, Trend trend, int streakDays) {

    public static LeaderboardRowView from(LeaderboardRow row) {
        return new LeaderboardRowView(row.getUserId(), row.getRank(), row.getScore(), row.getAchievementPct(),
                row.getTrend(), row.getStreakDays());
    }
}
