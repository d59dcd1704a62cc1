package com.verso.registry.common;

/**
 * Identity and timing of one inbound request. {@code uri} keeps the query string so audit events
 * record the exact listing that was asked for.
 */
public class RequestContext {
    private final String requestId;
    private final String traceId;
    private final String method;
    private final String uri;
    private final long startedAtNs;

    public RequestContext(String requestId, String traceId, String method, String uri, long startedAtNs) {
        this.requestId = requestId;
        this.traceId = traceId;
        this.method = method;
        this.uri = uri;
        this.startedAtNs = startedAtNs;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getMethod() {
        return method;
    }

    public String getUri() {
        return uri;
    }

    public long elapsedMs() {
        return (System.nanoTime() - startedAtNs) / 1_000_000L;
    }
}
