package com.deepansh.agenthost.context;

import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;
import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * W3C trace-context propagation across the loopback and control-plane hops.
 */
public final class TraceHeaders {

    private static final TextMapSetter<Map<String, String>> SETTER = Map::put;

    private static final TextMapGetter<HttpHeaders> GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(HttpHeaders carrier) {
            return carrier.keySet();
        }

        @Override
        public String get(HttpHeaders carrier, String key) {
            return carrier == null ? null : carrier.getFirst(key);
        }
    };

    private TraceHeaders() {
    }

    /** Adds {@code traceparent}/{@code tracestate} for the current context to {@code headers}. */
    public static Map<String, String> inject(Map<String, String> headers) {
        W3CTraceContextPropagator.getInstance().inject(Context.current(), headers, SETTER);
        return headers;
    }

    public static Context extract(HttpHeaders headers) {
        return W3CTraceContextPropagator.getInstance().extract(Context.current(), headers, GETTER);
    }
}
