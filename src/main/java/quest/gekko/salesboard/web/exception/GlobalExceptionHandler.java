package quest.gekko.salesboard.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.salesboard.service.exception.*;
import quest.gekko.salesboard.service.validation.ValidationException;
import quest.gekko.salesboard.web.dto.ErrorResponse;

import java.util.List;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponse handleValidation(ValidationException ex, HttpServletRequest request) {
        log.warn("Validation failed for URL: {}: {}", request.getRequestURL(), ex.getMessage());
        return new ErrorResponse(ex.getMessage(), ex.getCode(), false, ex.getViolations());
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNotFound(NotFoundException ex) {
        return ErrorResponse.of(ex.getMessage(), ex.getCode());
    }

    @ExceptionHandler(ScoringException.class)
    public ResponseEntity<ErrorResponse> handleScoring(ScoringException ex, HttpServletRequest request) {
        if (ex.getReason() != ScoringException.Reason.STORAGE_FAILED) {
            return handleConflict(ex, request);
        }
        log.error("Snapshot storage failed for URL: {}", request.getRequestURL(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ex.getMessage(), ex.getCode()));
    }

    @ExceptionHandler({ ConcurrencyException.class, PeriodStateException.class })
    public ResponseEntity<ErrorResponse> handleConflict(SalesboardException ex, HttpServletRequest request) {
        log.warn("Conflict [{}] for URL: {}: {}", ex.getCode(), request.getRequestURL(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(ex.getMessage(), ex.getCode(), ex.isRetryable(), List.of()));
    }

    @ExceptionHandler(RecomputeException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse handleRecompute(RecomputeException ex, HttpServletRequest request) {
        log.warn("Recompute failed for URL: {}: {}", request.getRequestURL(), ex.getMessage());
        return ErrorResponse.of(ex.getMessage(), ex.getCode());
    }

    // e.g. two requests creating the same shop month at once
    @ExceptionHandler(DataIntegrityViolationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse handleDataIntegrity(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.warn("Constraint violation for URL: {}: {}", request.getRequestURL(), ex.getMostSpecificCause().getMessage());
        return new ErrorResponse("The request conflicts with data written concurrently", "CONFLICT", true, List.of());
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class, IllegalArgumentException.class })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return ErrorResponse.of("Invalid request: " + ex.getMessage(), "BAD_REQUEST");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return ErrorResponse.of("An unexpected error occurred", "INTERNAL_ERROR");
    }
}
