package quest.gekko.salesboard.service.scoring;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;

/**
 * Everything a snapshot is computed from, already read under one consistent view.
 *
 * @param targetsByUser  total target per user over all weeks and categories
 * @param achievements   achievement entries of the period's date range
 * @param previousPct    achievement pct per user from the latest prior snapshot, empty when none exists
 */
public record ScoringInput(LocalDate periodStart,
                           Map<String, BigDecimal> targetsByUser,
                           Collection<Entry> achievements,
                           Map<String, BigDecimal> previousPct) {

    public record Entry(String userId, LocalDate occurredOn, BigDecimal value) {}
}
