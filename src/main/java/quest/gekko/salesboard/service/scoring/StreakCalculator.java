package quest.gekko.salesboard.service.scoring;

import java.time.LocalDate;
import java.util.Collection;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Consecutive days with at least one achievement, counted backwards from the user's most
 * recent active day. Days before the period start never count.
 */
public final class StreakCalculator {
    private StreakCalculator() {}

    public static int streak(Collection<LocalDate> activeDays, LocalDate periodStart) {
        NavigableSet<LocalDate> days = new TreeSet<>(activeDays);
        if (days.isEmpty()) return 0;

        int streak = 0;
        LocalDate day = days.last();
        while (!day.isBefore(periodStart) && days.contains(day)) {
            streak++;
            day = day.minusDays(1);
        }
        return streak;
    }
}
