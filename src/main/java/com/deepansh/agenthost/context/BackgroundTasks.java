package com.deepansh.agenthost.context;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Work a handler asked to run after its response has been produced.
 *
 * Tasks queue up during the invocation and are submitted once, by {@link #flush},
 * each inside its own {@code waitUntil} span. When every task has succeeded the
 * completion callback receives the time elapsed since the first task started.
 */
public class BackgroundTasks {

    private final List<Pending> tasks = new ArrayList<>();
    private final AtomicLong startedAt = new AtomicLong();
    private boolean flushed;

    public synchronized void add(Runnable task) {
        if (flushed) {
            throw new IllegalStateException("Cannot call waitUntil after the invocation has completed");
        }
        tasks.add(new Pending(Context.current(), ContextScopes.wrap(task)));
    }

    /**
     * Submits every queued task and returns a future that completes once they are
     * all done and {@code onCompleted} has run. Nothing is reported when no task was
     * queued. Task and report failures are recorded on spans and logged, never thrown;
     * the response they trail has already been sent.
     */
    public CompletableFuture<Void> flush(Executor executor, Tracer tracer, AgentLogger logger,
                                         Consumer<Duration> onCompleted) {
        List<Pending> pending;
        synchronized (this) {
            if (flushed) {
                throw new IllegalStateException("background tasks can only be flushed once per invocation");
            }
            flushed = true;
            pending = List.copyOf(tasks);
            tasks.clear();
        }
        if (pending.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<?>[] running = new CompletableFuture<?>[pending.size()];
        for (int i = 0; i < pending.size(); i++) {
            Pending task = pending.get(i);
            try {
                running[i] = CompletableFuture.runAsync(() -> runTraced(task, tracer, logger), executor);
            } catch (RejectedExecutionException e) {
                logger.error("background task rejected: {}", e.getMessage());
                running[i] = CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.allOf(running)
                .thenRun(() -> onCompleted.accept(Duration.ofMillis(System.currentTimeMillis() - startedAt.get())))
                .handle((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        logger.error("error sending session completed: {}", String.valueOf(cause.getMessage()));
                    }
                    return null;
                });
    }

    private void runTraced(Pending task, Tracer tracer, AgentLogger logger) {
        startedAt.compareAndSet(0, System.currentTimeMillis());
        Span span = tracer.spanBuilder("waitUntil").setParent(task.parent()).startSpan();
        try (Scope ignored = span.makeCurrent()) {
            task.body().run();
            span.setStatus(StatusCode.OK);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            logger.error("background task failed", e);
            throw e;
        } finally {
            span.end();
        }
    }

    private record Pending(Context parent, Runnable body) {
    }
}
