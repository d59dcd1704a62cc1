package com.verso.registry.listing;

/**
 * A named filter parameter bound to the index it selects.
 */
public record ListingFilter<V>(String name, FilterValues.FilterNormalizer normalizer, IndexSource<V> source) {

    public String normalize(String raw) {
        return normalizer.normalize(name, raw);
    }
}
