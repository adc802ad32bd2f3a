package com.grantmatcher.common.trace;

import org.slf4j.MDC;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Trace id plumbing for the matching pipeline.
 *
 * <p>The id arrives in {@value #TRACE_ID_HEADER} (or is generated at the edge), lives in the
 * Reactor Context under {@value #TRACE_ID_KEY}, is forwarded to collaborators on the same
 * header and is echoed in every error body. MDC is written only for the duration of a single
 * log statement.
 *
 * <pre>
 *     return Mono.deferContextual(ctx -> {
 *         String traceId = TraceContextUtil.getTraceId(ctx);
 *         ...
 *     });
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY    = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    static final int    MAX_TRACE_ID_LENGTH = 128;
    static final String UNKNOWN             = "unknown";

    private TraceContextUtil() {}

    /**
     * Accepts a caller-supplied id as is (trimmed); blank or oversized values are replaced by
     * a fresh random UUID.
     */
    public static String normalize(String candidate) {
        if (candidate == null || candidate.isBlank() || candidate.trim().length() > MAX_TRACE_ID_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return candidate.trim();
    }

    /** Context fragment to pass to {@code contextWrite}. */
    public static Context context(String traceId) {
        return Context.of(TRACE_ID_KEY, traceId);
    }

    /** Never {@code null}; {@code "unknown"} outside a traced request. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
