package quest.gekko.salesboard.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import quest.gekko.salesboard.domain.Period;
import quest.gekko.salesboard.domain.PeriodStatus;
import quest.gekko.salesboard.domain.PeriodWeek;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeriodView(Long id, String shopId, int year, int month, PeriodStatus status, Instant createdAt, List<WeekView> weeks) {

    public static PeriodView from(Period p) {
        return from(p, null);
    }

    public static PeriodView from(Period p, List<PeriodWeek> weeks) {
        return new PeriodView(p.getId(), p.getShopId(), p.getYear(), p.getMonth(), p.getStatus(), p.getCreatedAt(),
                weeks == null ? null : weeks.stream().map(WeekView::from).toList());
    }
}
