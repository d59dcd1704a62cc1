package com.verso.registry.common;

import java.util.Locale;

/**
 * Strict parsing of query and path parameters. Every failure names the offending parameter.
 */
public final class RequestParams {
    private RequestParams() {
    }

    public static boolean parseBoolean(String value, String parameter, boolean defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return switch (value) {
            case "1", "t", "T", "true", "TRUE", "True" -> true;
            case "0", "f", "F", "false", "FALSE", "False" -> false;
            default -> throw BadRequestException.invalid(parameter, value);
        };
    }

    /**
     * Parses a positive limit. Absent yields {@code null} so callers can tell "not supplied" from a default.
     */
    public static Integer parseLimit(String value, String parameter) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        int limit;
        try {
            limit = Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw BadRequestException.invalid(parameter, value);
        }
        if (limit < 1) {
            throw BadRequestException.invalid(parameter, value);
        }
        return limit;
    }

    public static String requireEntityId(String value, String parameter) {
        if (!IdGenerator.isEntityId(value)) {
            throw BadRequestException.invalid(parameter, value);
        }
        return value;
    }

    public static <E extends Enum<E>> E parseEnum(String value, String parameter, Class<E> type) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException(parameter, parameter + " is required");
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw BadRequestException.invalid(parameter, value);
        }
    }
}
