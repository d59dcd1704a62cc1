package com.verso.registry.listing;

import java.util.List;
import java.util.Optional;

/**
 * One slot per requested ID, in request order. An empty slot marks an entity that could not be
 * loaded.
 */
public final class FanOutResult<T> {
    private final List<Optional<T>> slots;

    FanOutResult(List<Optional<T>> slots) {
        this.slots = List.copyOf(slots);
    }

    public static <T> FanOutResult<T> empty() {
        return new FanOutResult<>(List.of());
    }

    public List<Optional<T>> getSlots() {
        return slots;
    }

    /**
     * Loaded entities in request order, missing slots dropped.
     */
    public List<T> present() {
        return slots.stream().flatMap(Optional::stream).toList();
    }

    public int size() {
        return slots.size();
    }

    public long missingCount() {
        return slots.stream().filter(Optional::isEmpty).count();
    }
}
