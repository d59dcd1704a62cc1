package com.verso.registry.common;

import org.springframework.http.HttpStatus;

/**
 * A malformed request parameter, always raised before the store is touched.
 */
public class BadRequestException extends ApiException {
    private final String parameter;

    public BadRequestException(String parameter, String message) {
        super(HttpStatus.BAD_REQUEST, "bad_request", message);
        this.parameter = parameter;
    }

    public static BadRequestException invalid(String parameter, String value) {
        return new BadRequestException(parameter, "invalid parameter, " + parameter + ": " + value);
    }

    public String getParameter() {
        return parameter;
    }
}
