package com.verso.registry.common;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Request, trace and entity identifiers.
 *
 * <p>Entity IDs are 16 base-62 characters: 10 characters of epoch microseconds followed by
 * 6 random characters. The alphabet is in ASCII order and the timestamp is fixed width, so
 * lexicographic order is creation order. Generated timestamps never repeat within a process.
 */
public final class IdGenerator {
    private static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_CHARS = 6;
    private static final Pattern ENTITY_ID = Pattern.compile("[0-9A-Za-z]{16}");
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final AtomicLong LAST_MICROS = new AtomicLong();
    private static final int TRACE_ID_BYTES = 16;

    private IdGenerator() {
    }

    public static String newEntityId() {
        return newEntityId(Instant.now());
    }

    static String newEntityId(Instant now) {
        long candidate = now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000L;
        long micros = LAST_MICROS.accumulateAndGet(candidate, (last, next) -> Math.max(last + 1, next));
        StringBuilder sb = new StringBuilder(TIME_CHARS + RANDOM_CHARS);
        sb.append(encode(micros, TIME_CHARS));
        for (int i = 0; i < RANDOM_CHARS; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    public static boolean isEntityId(String value) {
        return value != null && ENTITY_ID.matcher(value).matches();
    }

    /**
     * Returns the creation instant embedded in an entity ID.
     */
    public static Instant timestampOf(String entityId) {
        if (!isEntityId(entityId)) {
            throw new IllegalArgumentException("invalid entity id: " + entityId);
        }
        long micros = 0L;
        for (int i = 0; i < TIME_CHARS; i++) {
            micros = micros * ALPHABET.length() + ALPHABET.indexOf(entityId.charAt(i));
        }
        return Instant.ofEpochSecond(micros / 1_000_000L, (micros % 1_000_000L) * 1_000L);
    }

    public static String resolveRequestId(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        return "req_" + UUID.randomUUID().toString().replace("-", "");
    }

    public static String resolveTraceId(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            String trimmed = headerValue.trim();
            if (trimmed.length() == 32 && trimmed.chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
                return trimmed.toLowerCase(Locale.ROOT);
            }
        }
        byte[] buffer = new byte[TRACE_ID_BYTES];
        RANDOM.nextBytes(buffer);
        StringBuilder sb = new StringBuilder(TRACE_ID_BYTES * 2);
        for (byte b : buffer) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    private static String encode(long value, int width) {
        char[] out = new char[width];
        long remaining = value;
        for (int i = width - 1; i >= 0; i--) {
            out[i] = ALPHABET.charAt((int) (remaining % ALPHABET.length()));
            remaining /= ALPHABET.length();
        }
        return new String(out);
    }
}
