package com.verso.registry.listing;

import com.verso.registry.common.BadRequestException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Declarative description of one listing endpoint: its filters in precedence order, the index used
 * when no filter is supplied, and how values are rendered for search and sorting.
 */
public final class ListingDefinition<V> {
    private final String name;
    private final int defaultLimit;
    private final boolean allWhenLimitAbsent;
    private final Function<V, String> displayText;
    private final List<ListingFilter<V>> filters;
    private final IndexSource<V> defaultSource;
    private final String defaultKey;

    private ListingDefinition(Builder<V> builder) {
        this.name = builder.name;
        this.defaultLimit = builder.defaultLimit;
        this.allWhenLimitAbsent = builder.allWhenLimitAbsent;
        this.displayText = builder.displayText;
        this.filters = List.copyOf(builder.filters);
        this.defaultSource = builder.defaultSource;
        this.defaultKey = builder.defaultKey;
    }

    public static <V> Builder<V> builder(String name, Function<V, String> displayText) {
        return new Builder<>(name, displayText);
    }

    /**
     * Validates every supplied filter value, then returns the first one in precedence order, or the
     * default index when none was supplied.
     */
    public Selection<V> select(Map<String, String> query) {
        Selection<V> selected = null;
        for (ListingFilter<V> filter : filters) {
            String raw = query.get(filter.name());
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String key = filter.normalize(raw);
            if (selected == null) {
                selected = new Selection<>(filter.name(), key, filter.source());
            }
        }
        if (selected != null) {
            return selected;
        }
        if (defaultSource == null) {
            String names = filters.stream().map(ListingFilter::name).collect(Collectors.joining(", "));
            throw new BadRequestException(filters.isEmpty() ? name : filters.get(0).name(), "must specify one of: " + names);
        }
        return new Selection<>(null, defaultKey, defaultSource);
    }

    public String displayText(V value) {
        return Objects.toString(displayText.apply(value), "");
    }

    public String getName() {
        return name;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public boolean isAllWhenLimitAbsent() {
        return allWhenLimitAbsent;
    }

    public List<ListingFilter<V>> getFilters() {
        return filters;
    }

    public record Selection<V>(String filter, String key, IndexSource<V> source) {
    }

    public static final class Builder<V> {
        private final String name;
        private final Function<V, String> displayText;
        private final List<ListingFilter<V>> filters = new ArrayList<>();
        private int defaultLimit = 1000;
        private boolean allWhenLimitAbsent = true;
        private IndexSource<V> defaultSource;
        private String defaultKey;

        private Builder(String name, Function<V, String> displayText) {
            this.name = name;
            this.displayText = displayText;
        }

        public Builder<V> defaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
            return this;
        }

        public Builder<V> allWhenLimitAbsent(boolean allWhenLimitAbsent) {
            this.allWhenLimitAbsent = allWhenLimitAbsent;
            return this;
        }

        /**
         * Adds a filter. Filters take precedence in the order they are added.
         */
        public Builder<V> filter(String parameter, FilterValues.FilterNormalizer normalizer, IndexSource<V> source) {
            filters.add(new ListingFilter<>(parameter, normalizer, source));
            return this;
        }

        public Builder<V> defaultIndex(String key, IndexSource<V> source) {
            this.defaultKey = key;
            this.defaultSource = source;
            return this;
        }

        public ListingDefinition<V> build() {
            if (defaultLimit < 1) {
                throw new IllegalStateException("default limit must be positive for " + name);
            }
            return new ListingDefinition<>(this);
        }
    }
}
