package com.platform.gitops.error;

import com.platform.gitops.observability.LoggingConfig;
import com.platform.gitops.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Renders every API failure as an {@link ErrorResponse} carrying its stable error code.
 * Each rendered error is logged once and counted under {@code gitops.api.errors}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("{} {} not found", ex.getResourceType(), ex.getResourceId());
        return respond(ex.getErrorCode(), HttpStatus.NOT_FOUND, ex.getMessage(), request,
            b -> b.metadata(Map.of("resourceType", ex.getResourceType(), "resourceId", ex.getResourceId())));
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        log.warn("Rejected request on {}: {}", request.getRequestURI(), ex.getMessage());
        if (ex.getField() == null) {
            return respond(ex.getErrorCode(), statusOf(ex.getErrorCode()), ex.getMessage(), request, b -> b);
        }
        ErrorResponse.FieldError fieldError = ErrorResponse.FieldError.builder()
            .field(ex.getField())
            .message(ex.getMessage())
            .build();
        return respond(ex.getErrorCode(), statusOf(ex.getErrorCode()), ex.getMessage(), request,
            b -> b.fieldErrors(List.of(fieldError)));
    }
    
    @ExceptionHandler(ControllerException.class)
    public ResponseEntity<ErrorResponse> handleControllerException(ControllerException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.isFatal()) {
            log.error("{} on {}: {}", errorCode.getCode(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("{} on {}: {}", errorCode.getCode(), request.getRequestURI(), ex.getMessage());
        }
        return respond(errorCode, statusOf(errorCode), ex.getMessage(), request, b -> b);
    }
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSpec(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();
        log.warn("Spec for {} failed validation on {} field(s)", request.getRequestURI(), fieldErrors.size());
        return respond(ErrorCode.VALIDATION_ERROR, HttpStatus.BAD_REQUEST, "Validation failed", request,
            b -> b.fieldErrors(fieldErrors));
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return respond(ErrorCode.INVALID_REQUEST, HttpStatus.BAD_REQUEST, "Invalid request body", request,
            b -> b.detail(ex.getMostSpecificCause().getMessage()));
    }
    
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
        return respond(ErrorCode.INVALID_REQUEST, HttpStatus.UNSUPPORTED_MEDIA_TYPE,
            "Media type " + ex.getContentType() + " not supported", request, b -> b);
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return respond(ErrorCode.INVALID_REQUEST, HttpStatus.METHOD_NOT_ALLOWED,
            "Method " + ex.getMethod() + " not supported for this endpoint", request, b -> b);
    }
    
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConflict(OptimisticLockingFailureException ex, HttpServletRequest request) {
        log.warn("Unit modified concurrently on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(ErrorCode.OPTIMISTIC_LOCK_FAILURE, HttpStatus.CONFLICT,
            "Kustomization was modified concurrently, retry the request", request, b -> b);
    }
    
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStore(DataAccessException ex, HttpServletRequest request) {
        log.error("Store failure on {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, "Store operation failed", request,
            b -> b.detail(ex.getMostSpecificCause().getMessage()));
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred",
            request, b -> b.detail(ex.getClass().getSimpleName() + ": " + ex.getMessage()));
    }
    
    private ResponseEntity<ErrorResponse> respond(ErrorCode errorCode, HttpStatus status, String message,
                                                  HttpServletRequest request,
                                                  UnaryOperator<ErrorResponse.ErrorResponseBuilder> extra) {
        metricsRegistry.incrementCounter("gitops.api.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
        ErrorResponse body = extra.apply(ErrorResponse.builder()
                .code(errorCode.getCode())
                .message(message)
                .fatal(errorCode.isFatal())
                .status(status.value())
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .correlationId(correlationId()))
            .build();
        return ResponseEntity.status(status).body(body);
    }
    
    private static String correlationId() {
        String id = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        return id != null ? id : UUID.randomUUID().toString().substring(0, 8);
    }
    
    static HttpStatus statusOf(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, KUSTOMIZATION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RESOURCE_CONFLICT, OPTIMISTIC_LOCK_FAILURE -> HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, INVALID_FIELD_VALUE, INVALID_MANIFEST -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
