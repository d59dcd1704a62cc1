package com.verso.registry.common;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ApiException {

    public NotFoundException(String entityType, String id) {
        super(HttpStatus.NOT_FOUND, "not_found", "not found: " + entityType + " " + id);
    }
}
