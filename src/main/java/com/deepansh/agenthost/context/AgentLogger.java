package com.deepansh.agenthost.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leveled logger carrying a fixed set of context fields.
 *
 * The fields are pushed into the SLF4J MDC for the duration of each log call, so they
 * show up in the log pattern without callers touching MDC. {@link #child(Map)} merges
 * extra fields into a new logger; the parent is unchanged.
 */
public final class AgentLogger {

    private final Logger delegate;
    private final Map<String, String> context;

    private AgentLogger(Logger delegate, Map<String, String> context) {
        this.delegate = delegate;
        this.context = Collections.unmodifiableMap(context);
    }

    public static AgentLogger of(Class<?> type) {
        return new AgentLogger(LoggerFactory.getLogger(type), Map.of());
    }

    public static AgentLogger of(Logger delegate) {
        return new AgentLogger(delegate, Map.of());
    }

    public AgentLogger child(Map<String, ?> extra) {
        Map<String, String> merged = new LinkedHashMap<>(context);
        extra.forEach((k, v) -> merged.put(k, String.valueOf(v)));
        return new AgentLogger(delegate, merged);
    }

    public Map<String, String> context() {
        return context;
    }

    public void debug(String format, Object... args) {
        if (delegate.isDebugEnabled()) {
            withContext(() -> delegate.debug(format, args));
        }
    }

    public void info(String format, Object... args) {
        if (delegate.isInfoEnabled()) {
            withContext(() -> delegate.info(format, args));
        }
    }

    public void warn(String format, Object... args) {
        if (delegate.isWarnEnabled()) {
            withContext(() -> delegate.warn(format, args));
        }
    }

    public void error(String format, Object... args) {
        withContext(() -> delegate.error(format, args));
    }

    private void withContext(Runnable call) {
        if (context.isEmpty()) {
            call.run();
            return;
        }
        Map<String, String> previous = MDC.getCopyOfContextMap();
        context.forEach(MDC::put);
        try {
            call.run();
        } finally {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
