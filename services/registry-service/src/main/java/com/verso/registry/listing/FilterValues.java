package com.verso.registry.listing;

import com.verso.registry.common.BadRequestException;
import com.verso.registry.common.RequestParams;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizers for filter parameter values. Each returns the index key or throws
 * {@link BadRequestException} naming the parameter.
 */
public final class FilterValues {
    private static final Pattern EMAIL = Pattern.compile("[^@\\s]+@[^@\\s]+\\.[^@\\s]+");

    private FilterValues() {
    }

    public static FilterNormalizer text() {
        return (parameter, value) -> value.trim();
    }

    public static FilterNormalizer lowerCase() {
        return (parameter, value) -> value.trim().toLowerCase(Locale.ROOT);
    }

    public static FilterNormalizer entityId() {
        return (parameter, value) -> RequestParams.requireEntityId(value.trim(), parameter);
    }

    public static <E extends Enum<E>> FilterNormalizer enumValue(Class<E> type) {
        return (parameter, value) -> RequestParams.parseEnum(value, parameter, type).name();
    }

    public static FilterNormalizer date() {
        return (parameter, value) -> {
            try {
                return LocalDate.parse(value.trim()).toString();
            } catch (DateTimeParseException ex) {
                throw BadRequestException.invalid(parameter, value);
            }
        };
    }

    public static FilterNormalizer email() {
        return (parameter, value) -> {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if (!EMAIL.matcher(normalized).matches()) {
                throw BadRequestException.invalid(parameter, value);
            }
            return normalized;
        };
    }

    @FunctionalInterface
    public interface FilterNormalizer {
        String normalize(String parameter, String value);
    }
}
