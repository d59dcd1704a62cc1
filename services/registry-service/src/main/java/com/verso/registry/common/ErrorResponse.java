package com.verso.registry.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body shared by every failing endpoint. {@code parameter} is set only for malformed
 * parameters.
 */
public record ErrorResponse(
    ErrorDetail error,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("request_id") String requestId
) {

    public static ErrorResponse of(String code, String message) {
        return of(code, message, null);
    }

    public static ErrorResponse of(String code, String message, String parameter) {
        return new ErrorResponse(
            new ErrorDetail(code, message, parameter),
            RequestContextHolder.traceId(),
            RequestContextHolder.requestId()
        );
    }

    public static ErrorResponse from(ApiException ex) {
        String parameter = ex instanceof BadRequestException bad ? bad.getParameter() : null;
        return of(ex.getCode(), ex.getMessage(), parameter);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorDetail(String code, String message, String parameter) {
    }
}
