package com.verso.registry.common;

/**
 * Per-thread request context, set by {@link RegistryRequestContextFilter}. Work handed to other
 * threads must capture what it needs first.
 */
public final class RequestContextHolder {
    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static RequestContext get() {
        return CONTEXT.get();
    }

    public static String requestId() {
        RequestContext context = CONTEXT.get();
        return context == null ? null : context.getRequestId();
    }

    public static String traceId() {
        RequestContext context = CONTEXT.get();
        return context == null ? null : context.getTraceId();
    }

    public static void clear() {
        CONTEXT.remove();
    }
}
