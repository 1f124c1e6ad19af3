package quest.gekko.salesboard.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import quest.gekko.salesboard.service.validation.Violation;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String error, String code, boolean retryable, List<Violation> violations) {

    public static ErrorResponse of(String error, String code) {
        return new ErrorResponse(error, code, false, List.of());
    }
}
