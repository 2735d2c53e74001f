package com.complaintportal.exception;

import com.complaintportal.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

// Standard MVC exceptions (404 route, 405 method, ...) keep Spring's default handling from the superclass
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiError> handleRateLimit(RateLimitExceededException ex) {
        return ResponseEntity.status(ex.getErrorMessage().getStatus())
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(ApiError.of(ex.getMessage()));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiError> handleBusinessException(BusinessException ex) {
        return ResponseEntity.status(ex.getErrorMessage().getStatus())
                .body(ApiError.of(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(ErrorMessage.INTERNAL_ERROR.getStatus())
                .body(ApiError.of(ErrorMessage.INTERNAL_ERROR.getMessage()));
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(@NonNull MethodArgumentNotValidException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {
        ApiError.ApiErrorBuilder body = ApiError.builder().message(ErrorMessage.VALIDATION_FAILED.getMessage());
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            body.error(new ApiError.FieldViolation(fe.getField(), fe.getDefaultMessage()));
        }
        return ResponseEntity.status(ErrorMessage.VALIDATION_FAILED.getStatus()).body(body.build());
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(@NonNull HttpMessageNotReadableException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(ErrorMessage.MALFORMED_REQUEST.getStatus())
                .body(ApiError.of(ErrorMessage.MALFORMED_REQUEST.getMessage()));
    }
}
