package quest.gekko.salesboard.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Fixed-point helpers for the percentage splits. Nothing here goes through double.
 */
public final class Percentages {

    public static final BigDecimal HUNDRED = new BigDecimal("100.00");
    public static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private Percentages() {}

    public static BigDecimal sum(Collection<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static boolean withinCap(BigDecimal sum) {
        return sum.compareTo(HUNDRED) <= 0;
    }

    public static boolean complete(BigDecimal sum) {
        return sum.subtract(HUNDRED).abs().compareTo(TOLERANCE) <= 0;
    }

    /** value × pct / 100, exact (no rounding). */
    public static BigDecimal share(BigDecimal value, BigDecimal pct) {
        return value.multiply(pct).movePointLeft(2);
    }

    /** part × 100 / whole at 2 decimals, HALF_UP; 0.00 when whole is not positive. */
    public static BigDecimal ratio(BigDecimal part, BigDecimal whole) {
        if (whole.signum() <= 0) return BigDecimal.ZERO.setScale(2);
        return part.multiply(HUNDRED).divide(whole, 2, RoundingMode.HALF_UP);
    }

    public static boolean isValidPercentage(BigDecimal pct) {
        return pct != null && pct.signum() >= 0 && pct.compareTo(HUNDRED) <= 0 && pct.stripTrailingZeros().scale() <= 2;
    }

    public static boolean isValidAmount(BigDecimal amount) {
        return amount != null && amount.signum() >= 0 && amount.stripTrailingZeros().scale() <= 2;
    }
}
