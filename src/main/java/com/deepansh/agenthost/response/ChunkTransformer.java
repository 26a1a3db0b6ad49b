package com.deepansh.agenthost.response;

import java.util.function.Function;

/**
 * Maps one source item to at most one output item.
 */
@FunctionalInterface
public interface ChunkTransformer<T> {

    TransformResult apply(T item) throws Exception;

    /** Plain mapping form: a null result skips the item. */
    static <T> ChunkTransformer<T> mapping(Function<? super T, ?> fn) {
        return item -> TransformResult.of(fn.apply(item));
    }

    static <T> ChunkTransformer<T> identity() {
        return TransformResult::of;
    }
}
