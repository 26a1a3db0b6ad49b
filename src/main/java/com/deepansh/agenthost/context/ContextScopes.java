package com.deepansh.agenthost.context;

import io.opentelemetry.api.trace.Tracer;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Ambient access to the active {@link ContextScope}.
 *
 * The scope is bound to the invoking thread for exactly the duration of
 * {@link #callWithin}; nested calls restore the outer scope on exit. Work handed to
 * another thread must be wrapped with {@link #wrap(Runnable)}.
 */
public final class ContextScopes {

    private static final ThreadLocal<ContextScope> CURRENT = new ThreadLocal<>();

    private ContextScopes() {
    }

    /**
     * @throws IllegalStateException when called outside any invocation
     */
    public static ContextScope current() {
        ContextScope scope = CURRENT.get();
        if (scope == null) {
            throw new IllegalStateException("no active context scope: called outside of an agent invocation");
        }
        return scope;
    }

    public static Optional<ContextScope> find() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static Tracer tracer() {
        return current().getTracer();
    }

    public static String sdkVersion() {
        return current().getSdkVersion();
    }

    public static <T> T callWithin(ContextScope scope, Callable<T> call) throws Exception {
        ContextScope previous = CURRENT.get();
        Map<String, String> previousMdc = MDC.getCopyOfContextMap();
        CURRENT.set(scope);
        putMdc(scope);
        try {
            return call.call();
        } finally {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
            if (previousMdc == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previousMdc);
            }
        }
    }

    /**
     * Captures the caller's scope and MDC and reinstates them around {@code task} on
     * whichever thread runs it. The OpenTelemetry context is left to the caller.
     */
    public static Runnable wrap(Runnable task) {
        ContextScope captured = CURRENT.get();
        Map<String, String> capturedMdc = MDC.getCopyOfContextMap();
        return () -> {
            ContextScope previous = CURRENT.get();
            if (captured != null) {
                CURRENT.set(captured);
            }
            if (capturedMdc != null) {
                MDC.setContextMap(capturedMdc);
            }
            try {
                task.run();
            } finally {
                if (previous == null) {
                    CURRENT.remove();
                } else {
                    CURRENT.set(previous);
                }
                MDC.clear();
            }
        };
    }

    private static void putMdc(ContextScope scope) {
        MDC.put("runId", scope.getRunId());
        MDC.put("agentId", scope.getAgentId());
        if (scope.getSessionId() != null) {
            MDC.put("sessionId", scope.getSessionId());
        }
    }
}
