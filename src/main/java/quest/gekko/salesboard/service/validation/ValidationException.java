package quest.gekko.salesboard.service.validation;

import lombok.Getter;
import quest.gekko.salesboard.service.exception.SalesboardException;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class ValidationException extends SalesboardException {
    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super("VALIDATION_FAILED", violations.stream()
                .map(v -> v.field() + ": " + v.message())
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public static ValidationException of(String field, String scope, String message) {
        return new ValidationException(List.of(new Violation(field, scope, null, message)));
    }
}
