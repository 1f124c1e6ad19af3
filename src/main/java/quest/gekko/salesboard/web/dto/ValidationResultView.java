package quest.gekko.salesboard.web.dto;

import quest.gekko.salesboard.service.validation.ValidationReport;
import quest.gekko.salesboard.service.validation.Violation;

import java.util.List;

public record ValidationResultView(boolean valid, List<Violation> violations) {

    public static ValidationResultView from(ValidationReport report) {
        return new ValidationResultView(report.valid(), report.violations());
    }
}
