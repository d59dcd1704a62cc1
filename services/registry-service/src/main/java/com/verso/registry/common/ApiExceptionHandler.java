package com.verso.registry.common;

import com.verso.registry.audit.AuditService;
import com.verso.registry.domain.event.LogLevel;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final AuditService auditService;

    public ApiExceptionHandler(AuditService auditService) {
        this.auditService = auditService;
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApi(ApiException ex) {
        if (ex.getStatus().is5xxServerError()) {
            logger.warn(
                "api_exception request_id={} code={} message={}",
                RequestContextHolder.requestId(),
                ex.getCode(),
                ex.getMessage()
            );
        }
        return ResponseEntity.status(ex.getStatus()).body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", "request body is not valid JSON", "body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse framework && !framework.getStatusCode().is5xxServerError()) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            String code = status.getReasonPhrase().toLowerCase(Locale.ROOT).replace(' ', '_');
            return ResponseEntity.status(status).body(ErrorResponse.of(code, ex.getMessage()));
        }
        logger.error(
            "unexpected_exception request_id={} trace_id={} method={} path={}",
            RequestContextHolder.requestId(),
            RequestContextHolder.traceId(),
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        auditService.record(
            LogLevel.ERROR,
            null,
            null,
            (request == null ? "" : request.getMethod() + " " + request.getRequestURI() + " ") + "failed: " + ex
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("internal_error", "internal server error"));
    }
}
