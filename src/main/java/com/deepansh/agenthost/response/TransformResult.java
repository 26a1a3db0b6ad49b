package com.deepansh.agenthost.response;

/**
 * Outcome of transforming one stream item: drop it, or replace it with a value.
 */
public sealed interface TransformResult permits TransformResult.Skip, TransformResult.Value {

    static TransformResult skip() {
        return Skip.INSTANCE;
    }

    static TransformResult of(Object value) {
        return value == null ? Skip.INSTANCE : new Value(value);
    }

    final class Skip implements TransformResult {
        static final Skip INSTANCE = new Skip();

        private Skip() {
        }
    }

    record Value(Object value) implements TransformResult {
    }
}
