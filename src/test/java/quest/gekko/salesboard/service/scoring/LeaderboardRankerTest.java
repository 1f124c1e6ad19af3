package quest.gekko.salesboard.service.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import quest.gekko.salesboard.config.SalesboardProperties;
import quest.gekko.salesboard.domain.Trend;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LeaderboardRankerTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 1);

    private LeaderboardRanker ranker;

    @BeforeEach
    void setup() {
        ranker = new LeaderboardRanker(new SalesboardProperties.Leaderboard(new BigDecimal("0.001"), "v1"));
    }

    private static BigDecimal d(String v) {
        return new BigDecimal(v);
    }

    private static ScoringInput.Entry sale(String user, int day, String value) {
        return new ScoringInput.Entry(user, START.plusDays(day - 1), d(value));
    }

    @Test
    @DisplayName("Ranks by pct, then score, then user id, with no shared ranks")
    void ordersAndBreaksTies() {
        ScoringInput input = new ScoringInput(START,
                Map.of("alice", d("100.00"), "bob", d("200.00"), "carol", d("100.00"), "dave", d("100.00")),
                List.of(sale("alice", 1, "50.00"), sale("bob", 2, "100.00"), sale("carol", 3, "50.00"), sale("dave", 4, "90.00")),
                Map.of());

        List<RankedRow> rows = ranker.rank(input);

        assertEquals(List.of("dave", "bob", "alice", "carol"), rows.stream().map(RankedRow::userId).toList());
        assertEquals(List.of(1, 2, 3, 4), rows.stream().map(RankedRow::rank).toList());
        assertEquals(d("90.00"), rows.get(0).achievementPct());
        assertEquals(d("100.00"), rows.get(1).score());
        assertEquals(d("50.00"), rows.get(1).achievementPct());
    }

    @Test
    @DisplayName("A user with achievements but no target scores 0% and still ranks")
    void zeroTargetGuard() {
        ScoringInput input = new ScoringInput(START, Map.of("a", d("10.00")),
                List.of(sale("a", 1, "5.00"), sale("walk-in", 1, "40.00")), Map.of());

        List<RankedRow> rows = ranker.rank(input);

        assertEquals(2, rows.size());
        assertEquals("a", rows.get(0).userId());
        RankedRow walkIn = rows.get(1);
        assertEquals(d("0.00"), walkIn.achievementPct());
        assertEquals(d("40.00"), walkIn.score());
        assertEquals(2, walkIn.rank());
    }

    @Test
    void userWithTargetButNoSalesIsListed() {
        List<RankedRow> rows = ranker.rank(new ScoringInput(START, Map.of("idle", d("10.00")), List.of(), Map.of()));

        assertEquals(1, rows.size());
        assertEquals(d("0.00"), rows.get(0).score());
        assertEquals(0, rows.get(0).streakDays());
    }

    @Test
    void trendAgainstPreviousSnapshot() {
        ScoringInput input = new ScoringInput(START,
                Map.of("up", d("100.00"), "flat", d("100.00"), "down", d("100.00"), "new", d("100.00")),
                List.of(sale("up", 1, "85.00"), sale("flat", 1, "80.00"), sale("down", 1, "75.00"), sale("new", 1, "10.00")),
                Map.of("up", d("80.00"), "flat", d("80.00"), "down", d("80.00")));

        Map<String, Trend> trends = ranker.rank(input).stream()
                .collect(java.util.stream.Collectors.toMap(RankedRow::userId, RankedRow::trend));

        assertEquals(Trend.UP, trends.get("up"));
        assertEquals(Trend.FLAT, trends.get("flat"));
        assertEquals(Trend.DOWN, trends.get("down"));
        assertEquals(Trend.FLAT, trends.get("new"));
    }

    @Test
    void pctIsRoundedHalfUp() {
        List<RankedRow> rows = ranker.rank(new ScoringInput(START, Map.of("a", d("3.00")), List.of(sale("a", 1, "1.00")), Map.of()));

        assertEquals(d("33.33"), rows.get(0).achievementPct());
    }

    @Test
    void streakIsComputedPerUser() {
        ScoringInput input = new ScoringInput(START, Map.of("a", d("1.00"), "b", d("1.00")),
                List.of(sale("a", 3, "1.00"), sale("a", 4, "1.00"), sale("b", 1, "1.00"), sale("b", 4, "1.00")), Map.of());

        Map<String, Integer> streaks = ranker.rank(input).stream()
                .collect(java.util.stream.Collectors.toMap(RankedRow::userId, RankedRow::streakDays));

        assertEquals(2, streaks.get("a"));
        assertEquals(1, streaks.get("b"));
    }
}
