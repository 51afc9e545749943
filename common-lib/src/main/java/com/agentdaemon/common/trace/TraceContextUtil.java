package com.agentdaemon.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a per-cycle trace id through reactive chains.
 *
 * <p>Reactor Context is the source of truth for the trace id inside a cycle. MDC is only
 * written as a temporary bridge around a log statement, never left on a thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(cycleBody, trigger.traceId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    /** {@code cycle-<n>-<8 hex chars>}, unique per attempt even when a cycle number repeats. */
    public static String newCycleTraceId(long cycle) {
        return "cycle-" + cycle + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Returns the trace id stored in {@code ctx}, or {@code "unknown"}; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** Bridges {@code traceId} into MDC for the duration of {@code logAction} only. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
