package com.verso.registry.repository;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A secondary index: the keys an entity is filed under, and optionally the display text stored
 * alongside each row. Keys are never null or blank and never repeat for one entity.
 */
public record IndexDefinition<T>(String name, Function<T, Collection<String>> keys, Function<T, String> text) {
    /** Key of an index that files every entity under one group. */
    public static final String ALL_KEY = "*";
    /** Longest key the stores accept. */
    public static final int MAX_KEY_LENGTH = 512;

    public static <T> IndexDefinition<T> single(String name, Function<T, String> key, Function<T, String> text) {
        return new IndexDefinition<>(name, entity -> {
            String value = key.apply(entity);
            return value == null || value.isBlank() ? List.of() : List.of(value);
        }, text);
    }

    public static <T> IndexDefinition<T> multi(String name, Function<T, Collection<String>> keys, Function<T, String> text) {
        return new IndexDefinition<>(name, entity -> {
            Collection<String> values = keys.apply(entity);
            if (values == null) {
                return List.of();
            }
            return values.stream()
                .filter(Objects::nonNull)
                .filter(value -> !value.isBlank())
                .distinct()
                .toList();
        }, text);
    }

    public static <T> IndexDefinition<T> all(String name, Function<T, String> text) {
        return new IndexDefinition<>(name, entity -> List.of(ALL_KEY), text);
    }

    public String textOf(T entity) {
        return text == null ? null : text.apply(entity);
    }
}
