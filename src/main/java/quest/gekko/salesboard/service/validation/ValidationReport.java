package quest.gekko.salesboard.service.validation;

import java.util.ArrayList;
import java.util.List;

public record ValidationReport(List<Violation> violations) {

    public static ValidationReport ok() {
        return new ValidationReport(List.of());
    }

    public boolean valid() {
        return violations.isEmpty();
    }

    public ValidationReport and(ValidationReport other) {
        if (other.valid()) return this;
        if (valid()) return other;
        List<Violation> merged = new ArrayList<>(violations);
        merged.addAll(other.violations());
        return new ValidationReport(List.copyOf(merged));
    }

    public void orThrow() {
        if (!valid()) throw new ValidationException(violations);
    }
}
