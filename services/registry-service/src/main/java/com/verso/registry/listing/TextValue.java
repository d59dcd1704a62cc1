package com.verso.registry.listing;

/**
 * An entity ID paired with its human-readable display text.
 */
public record TextValue(String id, String value) {
}
