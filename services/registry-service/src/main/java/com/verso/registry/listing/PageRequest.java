package com.verso.registry.listing;

/**
 * One page of an index, read from an exclusive offset in the given direction.
 */
public record PageRequest(boolean reverse, int limit, String offset) {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public PageRequest {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        offset = Cursor.resolveOffset(reverse, offset);
    }

    public static PageRequest of(boolean reverse, int limit, String offset) {
        return new PageRequest(reverse, limit, offset);
    }

    public static PageRequest first(int limit) {
        return new PageRequest(false, limit, null);
    }

    public boolean isUnbounded() {
        return limit == UNBOUNDED;
    }
}
