package com.deepansh.agenthost.data;

import com.deepansh.agenthost.exception.AgentException;
import com.deepansh.agenthost.exception.DataFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.stream.Stream;

/**
 * Lazy holder for a payload.
 *
 * A container is backed either by an in-memory buffer or by a pull source of chunks.
 * The first materializing read drains the source into a buffer; from then on every
 * view ({@link #text()}, {@link #json()}, {@link #binary()}, {@link #base64()},
 * {@link #stream()}) reads the same cached bytes and the source is never touched again.
 *
 * Accepted chunk types: {@code byte[]}, {@link String} (UTF-8), {@link ByteBuffer}
 * and nested {@link Data}.
 */
public final class Data {

    public static final String OCTET_STREAM = "application/octet-stream";
    public static final String TEXT_PLAIN = "text/plain";
    public static final String APPLICATION_JSON = "application/json";

    static final Duration CHUNK_SMOOTHING = Duration.ofMillis(30);

    private final String contentType;
    private final Object lock = new Object();

    // guarded by lock; exactly one of source/buffer is non-null
    private Iterator<?> source;
    private byte[] buffer;

    private Data(String contentType, byte[] buffer, Iterator<?> source) {
        this.contentType = contentType != null ? contentType : OCTET_STREAM;
        this.buffer = buffer;
        this.source = source;
    }

    public static Data of(byte[] bytes, String contentType) {
        Objects.requireNonNull(bytes, "bytes");
        return new Data(contentType, bytes.clone(), null);
    }

    public static Data of(String text, String contentType) {
        Objects.requireNonNull(text, "text");
        return new Data(contentType, text.getBytes(StandardCharsets.UTF_8), null);
    }

    public static Data fromBase64(String base64, String contentType) {
        if (base64 == null || base64.isEmpty()) {
            return empty(contentType);
        }
        try {
            return new Data(contentType, Base64.getDecoder().decode(base64), null);
        } catch (IllegalArgumentException e) {
            throw new DataFormatException("payload is not valid base64", e);
        }
    }

    public static Data empty(String contentType) {
        return new Data(contentType, new byte[0], null);
    }

    public static Data fromStream(Iterator<?> chunks, String contentType) {
        Objects.requireNonNull(chunks, "chunks");
        return new Data(contentType, null, chunks);
    }

    public static Data fromStream(Stream<?> chunks, String contentType) {
        Objects.requireNonNull(chunks, "chunks");
        return fromStream(chunks.iterator(), contentType);
    }

    public static Data fromStream(Iterable<?> chunks, String contentType) {
        Objects.requireNonNull(chunks, "chunks");
        return fromStream(chunks.iterator(), contentType);
    }

    /**
     * Push-style source. Items are buffered as they arrive and handed out on the
     * first materializing read, which blocks until the publisher completes.
     */
    public static Data fromPublisher(Flow.Publisher<?> publisher, String contentType) {
        Objects.requireNonNull(publisher, "publisher");
        return fromStream(new PublisherIterator(publisher), contentType);
    }

    /**
     * Wraps an arbitrary payload value. {@code fallbackContentType} applies when the value
     * does not determine one itself: a {@link Data} keeps its own type, strings default to
     * text/plain, raw bytes and chunk sources to octet-stream, anything else is encoded as
     * JSON and defaults to application/json.
     */
    public static Data from(Object value, String fallbackContentType) {
        if (value == null) {
            return empty(fallbackContentType != null ? fallbackContentType : TEXT_PLAIN);
        }
        if (value instanceof Data data) {
            return data;
        }
        if (value instanceof String s) {
            return of(s, fallbackContentType != null ? fallbackContentType : TEXT_PLAIN);
        }
        String rawType = fallbackContentType != null ? fallbackContentType : OCTET_STREAM;
        if (value instanceof byte[] bytes) {
            return of(bytes, rawType);
        }
        if (value instanceof ByteBuffer buffer) {
            return new Data(rawType, toBytes(buffer), null);
        }
        if (value instanceof InputStream in) {
            try (in) {
                return new Data(rawType, in.readAllBytes(), null);
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read payload", e);
            }
        }
        if (value instanceof Iterator<?> chunks) {
            return fromStream(chunks, rawType);
        }
        return new Data(fallbackContentType != null ? fallbackContentType : APPLICATION_JSON,
                JsonCodec.toBytes(value), null);
    }

    public String contentType() {
        return contentType;
    }

    public boolean isMaterialized() {
        synchronized (lock) {
            return source == null;
        }
    }

    public String text() {
        byte[] data = materialize();
        if (data.length == 0) {
            return "";
        }
        return new String(data, StandardCharsets.UTF_8);
    }

    public JsonNode json() {
        String text = text();
        if (text.isBlank()) {
            throw new DataFormatException("Cannot parse empty JSON");
        }
        try {
            return JsonCodec.strictReader().readTree(text);
        } catch (JsonProcessingException e) {
            throw new DataFormatException("The content type is not valid JSON", e);
        }
    }

    public <T> T object(Class<T> type) {
        try {
            return JsonCodec.mapper().treeToValue(json(), type);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new DataFormatException("Failed to parse object: " + e.getMessage(), e);
        }
    }

    public <T> T object(TypeReference<T> type) {
        try {
            return JsonCodec.mapper().convertValue(json(), type);
        } catch (RuntimeException e) {
            throw new DataFormatException("Failed to parse object: " + e.getMessage(), e);
        }
    }

    public byte[] binary() {
        return materialize().clone();
    }

    public String base64() {
        return Base64.getEncoder().encodeToString(materialize());
    }

    /**
     * Re-chunks the materialized bytes. Textual payloads ({@code text/*},
     * {@code application/json}) come out one line per chunk, newline included, with a
     * short pause between chunks; anything else is a single chunk.
     */
    public Iterator<byte[]> stream() {
        byte[] data = materialize();
        if (!isTextChunkable()) {
            return List.of(data).iterator();
        }
        return new LineChunkIterator(new String(data, StandardCharsets.UTF_8), CHUNK_SMOOTHING);
    }

    @Override
    public String toString() {
        return "[Data " + contentType + "]";
    }

    private boolean isTextChunkable() {
        return contentType.startsWith("text/") || contentType.equals(APPLICATION_JSON);
    }

    private byte[] materialize() {
        synchronized (lock) {
            if (source != null) {
                buffer = drain(source);
                source = null;
            }
            return buffer;
        }
    }

    private static byte[] drain(Iterator<?> chunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (chunks.hasNext()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AgentException("stream read aborted");
            }
            Object chunk = chunks.next();
            if (chunk != null) {
                out.writeBytes(toBytes(chunk));
            }
        }
        return out.toByteArray();
    }

    static byte[] toBytes(Object chunk) {
        if (chunk instanceof byte[] bytes) {
            return bytes;
        }
        if (chunk instanceof String s) {
            return s.getBytes(StandardCharsets.UTF_8);
        }
        if (chunk instanceof ByteBuffer bb) {
            ByteBuffer copy = bb.duplicate();
            byte[] bytes = new byte[copy.remaining()];
            copy.get(bytes);
            return bytes;
        }
        if (chunk instanceof Data d) {
            return d.materialize();
        }
        throw new DataFormatException("Unsupported value type: " + chunk.getClass().getName());
    }
}
