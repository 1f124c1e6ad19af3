package quest.gekko.salesboard.dto;

import java.time.LocalDate;
import java.util.List;

public record WeeklyProgressView(int weekIndex, LocalDate startDate, LocalDate endDate, List<UserWeeklyProgressView> users) {
}
