package quest.gekko.salesboard.service.scoring;

import quest.gekko.salesboard.domain.Trend;

import java.math.BigDecimal;

/**
 * Direction of a user's achievement pct against the previous snapshot.
 */
public final class TrendEvaluator {
    private TrendEvaluator() {}

    public static Trend evaluate(BigDecimal previous, BigDecimal current, BigDecimal epsilon) {
        if (previous == null || current == null) return Trend.FLAT;
        BigDecimal diff = current.subtract(previous);
        if (diff.compareTo(epsilon) > 0) return Trend.UP;
        if (diff.compareTo(epsilon.negate()) < 0) return Trend.DOWN;
        return Trend.FLAT;
    }
}
