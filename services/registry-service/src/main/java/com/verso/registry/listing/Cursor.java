package com.verso.registry.listing;

/**
 * Pagination cursor codec. An offset is an entity ID, exclusive, or one of two sentinels that sort
 * before every digit ({@link #MIN}) and after every letter ({@link #MAX}).
 */
public final class Cursor {
    public static final String MIN = "-";
    public static final String MAX = "|";

    private Cursor() {
    }

    public static String resolveOffset(boolean reverse, String supplied) {
        if (supplied == null || supplied.isEmpty()) {
            return reverse ? MAX : MIN;
        }
        return supplied;
    }

    public static boolean isSentinel(String offset) {
        return MIN.equals(offset) || MAX.equals(offset);
    }
}
