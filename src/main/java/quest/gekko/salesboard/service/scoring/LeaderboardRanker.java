package quest.gekko.salesboard.service.scoring;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.salesboard.config.SalesboardProperties;
import quest.gekko.salesboard.util.Percentages;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.*;

/**
 * Scores and ranks the users of one period. Pure computation, persistence is the caller's job.
 * <p>
 * Order is achievement pct descending, then score descending, then user id ascending, which
 * makes every rank unique.
 */
@Component
@RequiredArgsConstructor
public class LeaderboardRanker {

    static final Comparator<Scored> ORDER = Comparator.comparing(Scored::achievementPct).reversed()
            .thenComparing(Comparator.comparing(Scored::score).reversed())
            .thenComparing(Scored::userId);

    private final SalesboardProperties.Leaderboard leaderboard;

    record Scored(String userId, BigDecimal score, BigDecimal achievementPct) {}

    public List<RankedRow> rank(ScoringInput input) {
        Map<String, BigDecimal> achieved = new TreeMap<>();
        Map<String, List<LocalDate>> activeDays = new HashMap<>();
        for (ScoringInput.Entry e : input.achievements()) {
            achieved.merge(e.userId(), e.value(), BigDecimal::add);
            activeDays.computeIfAbsent(e.userId(), k -> new ArrayList<>()).add(e.occurredOn());
        }

        Set<String> users = new TreeSet<>(input.targetsByUser().keySet());
        users.addAll(achieved.keySet());

        List<Scored> scored = new ArrayList<>(users.size());
        for (String userId : users) {
            BigDecimal target = input.targetsByUser().getOrDefault(userId, BigDecimal.ZERO);
            BigDecimal total = achieved.getOrDefault(userId, BigDecimal.ZERO);
            scored.add(new Scored(userId, total.setScale(2, RoundingMode.HALF_UP), Percentages.ratio(total, target)));
        }
        scored.sort(ORDER);

        List<RankedRow> rows = new ArrayList<>(scored.size());
        int rank = 1;
        for (Scored s : scored) {
            rows.add(new RankedRow(s.userId(), rank++, s.score(), s.achievementPct(),
                    TrendEvaluator.evaluate(input.previousPct().get(s.userId()), s.achievementPct(), leaderboard.trendEpsilon()),
                    StreakCalculator.streak(activeDays.getOrDefault(s.userId(), List.of()), input.periodStart())));
        }
        return rows;
    }
}
