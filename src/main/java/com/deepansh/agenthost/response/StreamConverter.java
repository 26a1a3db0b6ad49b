package com.deepansh.agenthost.response;

import com.deepansh.agenthost.data.Data;
import com.deepansh.agenthost.data.JsonCodec;
import com.deepansh.agenthost.exception.AgentException;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Streaming auto-conversion.
 *
 * <p>Each item is encoded on its own: raw items (string, bytes, byte buffer, {@link Data})
 * pass through untouched and anything else is written as one line of JSON. Only the default
 * content type depends on the first surviving item, which is pulled eagerly: raw gives
 * {@code application/octet-stream}, structured gives {@code application/json}. Remaining
 * items are pulled lazily, so a failure in the source or the transformer surfaces when the
 * output is drained.
 */
final class StreamConverter<T> implements Iterator<Object> {

    private final Iterator<? extends T> source;
    private final ChunkTransformer<? super T> transformer;
    private final boolean structured;
    private Object pending;

    StreamConverter(Iterator<? extends T> source, ChunkTransformer<? super T> transformer) {
        this.source = source;
        this.transformer = transformer != null ? transformer : ChunkTransformer.identity();
        Object first = pullNext();
        this.structured = first != null && !isReadable(first);
        this.pending = first;
    }

    String inferContentType() {
        return structured ? Data.APPLICATION_JSON : Data.OCTET_STREAM;
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = pullNext();
        }
        return pending != null;
    }

    @Override
    public Object next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Object item = pending;
        pending = null;
        return isReadable(item) ? item : JsonCodec.stringify(item) + "\n";
    }

    private Object pullNext() {
        while (source.hasNext()) {
            T item = source.next();
            TransformResult result;
            try {
                result = transformer.apply(item);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new AgentException("stream transform failed: " + e.getMessage(), e);
            }
            if (result instanceof TransformResult.Value value && value.value() != null) {
                return value.value();
            }
        }
        return null;
    }

    static boolean isReadable(Object item) {
        return item instanceof String
                || item instanceof byte[]
                || item instanceof ByteBuffer
                || item instanceof Data;
    }
}
