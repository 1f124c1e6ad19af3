package quest.gekko.salesboard.web.dto;

import quest.gekko.salesboard.domain.PeriodWeek;

import java.time.LocalDate;

public record WeekView(int weekIndex, LocalDate startDate, LocalDate endDate, int dayCount) {

    public static WeekView from(PeriodWeek w) {
        return new WeekView(w.getWeekIndex(), w.getStartDate(), w.getEndDate(), w.getDayCount());
    }
}
