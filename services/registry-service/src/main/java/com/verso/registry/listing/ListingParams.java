package com.verso.registry.listing;

import com.verso.registry.common.RequestParams;
import java.util.Map;

/**
 * Query parameters shared by every listing endpoint.
 */
public record ListingParams(
    boolean reverse,
    Integer limit,
    int defaultLimit,
    String offset,
    boolean sorted,
    String search,
    boolean matchAny
) {
    public static final String REVERSE = "reverse";
    public static final String LIMIT = "limit";
    public static final String OFFSET = "offset";
    public static final String SORTED = "sorted";
    public static final String SEARCH = "search";
    public static final String ANY = "any";

    public static ListingParams parse(Map<String, String> query, int defaultLimit) {
        boolean reverse = RequestParams.parseBoolean(query.get(REVERSE), REVERSE, false);
        Integer limit = RequestParams.parseLimit(query.get(LIMIT), LIMIT);
        boolean sorted = RequestParams.parseBoolean(query.get(SORTED), SORTED, false);
        boolean matchAny = RequestParams.parseBoolean(query.get(ANY), ANY, false);
        String search = query.get(SEARCH);
        return new ListingParams(
            reverse,
            limit,
            defaultLimit,
            Cursor.resolveOffset(reverse, query.get(OFFSET)),
            sorted,
            search == null || search.isEmpty() ? null : search,
            matchAny
        );
    }

    public boolean hasLimit() {
        return limit != null;
    }

    public boolean hasSearch() {
        return search != null;
    }

    public SearchQuery searchQuery() {
        return SearchQuery.compile(search, matchAny);
    }

    public PageRequest page() {
        return PageRequest.of(reverse, limit == null ? defaultLimit : limit, offset);
    }
}
