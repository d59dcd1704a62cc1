package com.verso.registry.listing;

import com.verso.registry.common.ApiException;
import org.springframework.http.HttpStatus;

public class FanOutTimeoutException extends ApiException {

    public FanOutTimeoutException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "fan_out_timeout", message);
    }
}
