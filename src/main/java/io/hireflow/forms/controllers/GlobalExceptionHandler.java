package io.hireflow.forms.controllers;

import static io.hireflow.forms.util.TimeUtils.utcNow;

import io.hireflow.forms.clients.ai.FieldSuggestionClientException;
import io.hireflow.forms.errors.FormsException;
import io.hireflow.forms.errors.QuotaExceededException;
import io.hireflow.forms.errors.RateLimitExceededException;
import io.hireflow.forms.model.ErrorResponse;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import io.micrometer.tracing.Tracer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Centralised exception mapping for REST controllers.
 * Every error body carries a stable code and the current trace id.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Tracer tracer;

    private String traceId() {
        String traceId = null;
        try {
            traceId = Objects.requireNonNull(tracer.currentSpan()).context().traceId();
        } catch (Exception ignored) {
            // no active span
        }
        return traceId;
    }

    private ErrorResponse base(final HttpStatusCode status, final String code, final String message) {
        final HttpStatus resolved = HttpStatus.resolve(status.value());
        return new ErrorResponse(
                resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value()),
                code,
                message,
                utcNow(),
                traceId(),
                null);
    }

    @ExceptionHandler(FormsException.class)
    public ResponseEntity<ErrorResponse> onFormsException(final FormsException formsException) {
        log.warn("{} status={} message={}", formsException.getCode(), formsException.getStatus().value(),
                formsException.getMessage());
        final ErrorResponse err = base(formsException.getStatus(), formsException.getCode(), formsException.getMessage())
                .withDetails(formsException.details());
        final ResponseEntity.BodyBuilder builder = ResponseEntity.status(formsException.getStatus());
        if (formsException instanceof QuotaExceededException quota) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(quota.getRetryAfterSeconds()));
        } else if (formsException instanceof RateLimitExceededException rateLimited) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(rateLimited.getDecision().retryAfterSeconds()));
        }
        return builder.body(err);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> onOptimisticLock(final ObjectOptimisticLockingFailureException exception) {
        log.warn("Concurrent modification of {} id={}", exception.getPersistentClassName(), exception.getIdentifier());
        final ErrorResponse err = base(HttpStatus.CONFLICT, "CONCURRENT_MODIFICATION",
                "The record was changed by another request. Please reload and try again.");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(err);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> onUploadTooLarge(final MaxUploadSizeExceededException exception) {
        log.warn("Upload rejected: {}", exception.getMessage());
        final ErrorResponse err = base(HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE", "The file is too large to upload.");
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(err);
    }

    @ExceptionHandler(FieldSuggestionClientException.class)
    public ResponseEntity<ErrorResponse> onSuggestionFailure(final FieldSuggestionClientException exception) {
        log.warn("Field suggestion failed: {}", exception.getMessage());
        final ErrorResponse err = base(HttpStatus.BAD_GATEWAY, "SUGGESTION_UNAVAILABLE",
                "Suggestions are temporarily unavailable. Please try again later.");
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(err);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> onResponseStatus(final ResponseStatusException responseStatusException) {
        log.warn("ResponseStatusException status={} reason={}", responseStatusException.getStatusCode(), responseStatusException.getReason());
        final ErrorResponse err = base(responseStatusException.getStatusCode(),
                String.valueOf(responseStatusException.getStatusCode().value()),
                responseStatusException.getReason() != null ? responseStatusException.getReason() : responseStatusException.getMessage());
        return ResponseEntity.status(responseStatusException.getStatusCode()).body(err);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> onValidation(final MethodArgumentNotValidException methodArgumentNotValidException) {
        final Map<String, String> fieldErrors = new LinkedHashMap<>();
        methodArgumentNotValidException.getBindingResult()
                .getFieldErrors()
                .forEach(fieldError -> fieldErrors.putIfAbsent(fieldError.getField(), messageOf(fieldError)));
        final String details = fieldErrors.entrySet().stream()
                .map(entry -> entry.getKey() + " " + entry.getValue())
                .collect(Collectors.joining("; "));
        log.warn("Validation failed: {}", details);
        final ErrorResponse err = base(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", details)
                .withDetails(Map.of("fieldErrors", fieldErrors));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> onConstraint(final ConstraintViolationException constraintViolationException) {
        final String details = constraintViolationException.getConstraintViolations()
                .stream()
                .map(GlobalExceptionHandler::formatViolation)
                .collect(Collectors.joining("; "));
        log.warn("Constraint violation: {}", details);
        final ErrorResponse err = base(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", details);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> onUnreadable(final HttpMessageNotReadableException httpMessageNotReadableException) {
        log.warn("Malformed request body: {}", httpMessageNotReadableException.getMessage());
        final ErrorResponse err = base(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Malformed request body");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> onUnexpected(final Exception exception) {
        log.error("Unexpected error", exception);
        final ErrorResponse err = base(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(err);
    }

    private static String messageOf(final FieldError fieldError) {
        return fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "is invalid";
    }

    private static String formatViolation(final ConstraintViolation<?> constraintViolation) {
        return constraintViolation.getPropertyPath() + " " + (constraintViolation.getMessage() != null ? constraintViolation.getMessage() : "is invalid");
    }
}
