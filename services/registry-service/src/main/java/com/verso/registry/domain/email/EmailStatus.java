package com.verso.registry.domain.email;

public enum EmailStatus {
    PENDING,
    SENT,
    UNSENT,
    ERROR
}
