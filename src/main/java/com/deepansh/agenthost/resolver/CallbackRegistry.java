package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.response.AgentResponseData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide correlation of reply ids to waiting remote invocations.
 *
 * Each id resolves at most once: {@link #received} removes the entry before completing
 * it, so duplicate or late deliveries find nothing and are dropped.
 */
@Component
@Slf4j
public class CallbackRegistry {

    private final ConcurrentMap<String, CompletableFuture<AgentResponseData>> pending = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if {@code replyId} is already pending
     */
    public CompletableFuture<AgentResponseData> register(String replyId) {
        CompletableFuture<AgentResponseData> future = new CompletableFuture<>();
        if (pending.putIfAbsent(replyId, future) != null) {
            throw new IllegalStateException("reply id already registered: " + replyId);
        }
        return future;
    }

    /** @return false when no invocation was waiting on {@code replyId} */
    public boolean received(String replyId, AgentResponseData payload) {
        CompletableFuture<AgentResponseData> future = pending.remove(replyId);
        if (future == null) {
            log.debug("Dropping reply for unknown or completed id: {}", replyId);
            return false;
        }
        return future.complete(payload);
    }

    public boolean failed(String replyId, Throwable error) {
        CompletableFuture<AgentResponseData> future = pending.remove(replyId);
        return future != null && future.completeExceptionally(error);
    }

    /** Removes {@code replyId} without completing it; the waiter has given up. */
    public void cancel(String replyId) {
        pending.remove(replyId);
    }

    public boolean isPending(String replyId) {
        return pending.containsKey(replyId);
    }

    public int pendingCount() {
        return pending.size();
    }
}
