package com.verso.registry.domain;

/**
 * Lifecycle status shared by users and organizations.
 */
public enum Status {
    PENDING,
    ENABLED,
    DISABLED
}
