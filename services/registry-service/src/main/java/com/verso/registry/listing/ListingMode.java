package com.verso.registry.listing;

public enum ListingMode {
    SEARCH,
    ALL,
    PAGE;

    public static ListingMode select(ListingParams params, boolean allWhenLimitAbsent) {
        if (params.hasSearch()) {
            return SEARCH;
        }
        if (params.sorted() || (!params.hasLimit() && allWhenLimitAbsent)) {
            return ALL;
        }
        return PAGE;
    }
}
