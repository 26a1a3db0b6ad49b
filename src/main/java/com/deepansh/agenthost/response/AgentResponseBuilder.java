package com.deepansh.agenthost.response;

import com.deepansh.agenthost.data.Data;
import com.deepansh.agenthost.data.JsonCodec;
import com.deepansh.agenthost.data.PublisherIterator;
import com.deepansh.agenthost.model.AgentReference;
import com.deepansh.agenthost.model.InvocationArguments;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.Flow;
import java.util.stream.Stream;

/**
 * Handed to every handler invocation for building its result.
 *
 * Each typed builder wraps the value in a {@link Data} container with a fixed content type
 * and validates the metadata up front. {@link #stream} infers the content type from the
 * first item when none is given. {@link #handoff} performs no I/O; the router acts on it.
 */
public class AgentResponseBuilder {

    public HandoffResult handoff(AgentReference agent) {
        return handoff(agent, null);
    }

    public HandoffResult handoff(AgentReference agent, InvocationArguments args) {
        if (args != null) {
            MetadataValidator.requireJsonObject(args.getMetadata());
        }
        return new HandoffResult(agent, args);
    }

    public AgentResponseData empty() {
        return empty(null);
    }

    public AgentResponseData empty(Map<String, Object> metadata) {
        return build(Data.empty(Data.TEXT_PLAIN), metadata);
    }

    public AgentResponseData text(String text) {
        return text(text, null);
    }

    public AgentResponseData text(String text, Map<String, Object> metadata) {
        return build(Data.of(text, Data.TEXT_PLAIN), metadata);
    }

    public AgentResponseData json(Object value) {
        return json(value, null);
    }

    public AgentResponseData json(Object value, Map<String, Object> metadata) {
        return build(Data.of(JsonCodec.toBytes(value), Data.APPLICATION_JSON), metadata);
    }

    public AgentResponseData html(String html) {
        return html(html, null);
    }

    public AgentResponseData html(String html, Map<String, Object> metadata) {
        return build(Data.of(html, "text/html"), metadata);
    }

    public AgentResponseData markdown(String content) {
        return markdown(content, null);
    }

    public AgentResponseData markdown(String content, Map<String, Object> metadata) {
        return build(Data.of(content, "text/markdown"), metadata);
    }

    public AgentResponseData binary(Object data) {
        return data(data, Data.OCTET_STREAM, null);
    }

    public AgentResponseData binary(Object data, Map<String, Object> metadata) {
        return data(data, Data.OCTET_STREAM, metadata);
    }

    public AgentResponseData pdf(Object data) {
        return data(data, "application/pdf", null);
    }

    public AgentResponseData pdf(Object data, Map<String, Object> metadata) {
        return data(data, "application/pdf", metadata);
    }

    public AgentResponseData png(Object data) {
        return data(data, "image/png", null);
    }

    public AgentResponseData png(Object data, Map<String, Object> metadata) {
        return data(data, "image/png", metadata);
    }

    public AgentResponseData jpeg(Object data) {
        return data(data, "image/jpeg", null);
    }

    public AgentResponseData jpeg(Object data, Map<String, Object> metadata) {
        return data(data, "image/jpeg", metadata);
    }

    public AgentResponseData gif(Object data) {
        return data(data, "image/gif", null);
    }

    public AgentResponseData gif(Object data, Map<String, Object> metadata) {
        return data(data, "image/gif", metadata);
    }

    public AgentResponseData webp(Object data) {
        return data(data, "image/webp", null);
    }

    public AgentResponseData webp(Object data, Map<String, Object> metadata) {
        return data(data, "image/webp", metadata);
    }

    public AgentResponseData mp3(Object data) {
        return data(data, "audio/mpeg", null);
    }

    public AgentResponseData mp3(Object data, Map<String, Object> metadata) {
        return data(data, "audio/mpeg", metadata);
    }

    public AgentResponseData mp4(Object data) {
        return data(data, "audio/mp4", null);
    }

    public AgentResponseData mp4(Object data, Map<String, Object> metadata) {
        return data(data, "audio/mp4", metadata);
    }

    public AgentResponseData m4a(Object data) {
        return data(data, "audio/m4a", null);
    }

    public AgentResponseData m4a(Object data, Map<String, Object> metadata) {
        return data(data, "audio/m4a", metadata);
    }

    public AgentResponseData m4p(Object data) {
        return data(data, "audio/m4p", null);
    }

    public AgentResponseData m4p(Object data, Map<String, Object> metadata) {
        return data(data, "audio/m4p", metadata);
    }

    public AgentResponseData webm(Object data) {
        return data(data, "audio/webm", null);
    }

    public AgentResponseData webm(Object data, Map<String, Object> metadata) {
        return data(data, "audio/webm", metadata);
    }

    public AgentResponseData wav(Object data) {
        return data(data, "audio/wav", null);
    }

    public AgentResponseData wav(Object data, Map<String, Object> metadata) {
        return data(data, "audio/wav", metadata);
    }

    public AgentResponseData ogg(Object data) {
        return data(data, "audio/ogg", null);
    }

    public AgentResponseData ogg(Object data, Map<String, Object> metadata) {
        return data(data, "audio/ogg", metadata);
    }

    /**
     * Generic builder. {@code contentType} is the fallback when the value does not
     * determine one itself: a {@link Data} keeps its own type, strings default to
     * text/plain, bytes to octet-stream, anything else is encoded as JSON.
     */
    public AgentResponseData data(Object value, String contentType, Map<String, Object> metadata) {
        return build(Data.from(value, contentType), metadata);
    }

    public <T> AgentResponseData stream(Iterator<? extends T> source) {
        return stream(source, null, null, null);
    }

    public <T> AgentResponseData stream(Iterator<? extends T> source, String contentType) {
        return stream(source, contentType, null, null);
    }

    public <T> AgentResponseData stream(Iterable<? extends T> source, String contentType,
                                        Map<String, Object> metadata, ChunkTransformer<? super T> transformer) {
        return stream(source.iterator(), contentType, metadata, transformer);
    }

    public <T> AgentResponseData stream(Stream<? extends T> source, String contentType,
                                        Map<String, Object> metadata, ChunkTransformer<? super T> transformer) {
        return stream(source.iterator(), contentType, metadata, transformer);
    }

    @SuppressWarnings("unchecked")
    public <T> AgentResponseData stream(Flow.Publisher<? extends T> source, String contentType,
                                        Map<String, Object> metadata, ChunkTransformer<? super T> transformer) {
        Iterator<T> pulled = (Iterator<T>) new PublisherIterator(source);
        return stream(pulled, contentType, metadata, transformer);
    }

    /**
     * Streams {@code source} through the optional {@code transformer}. Only the first
     * item is read here; everything after it is read when the returned data is consumed.
     */
    public <T> AgentResponseData stream(Iterator<? extends T> source, String contentType,
                                        Map<String, Object> metadata, ChunkTransformer<? super T> transformer) {
        MetadataValidator.requireJsonObject(metadata);
        StreamConverter<T> converter = new StreamConverter<>(source, transformer);
        String resolvedType = contentType != null ? contentType : converter.inferContentType();
        return new AgentResponseData(Data.fromStream(converter, resolvedType), metadata);
    }

    private AgentResponseData build(Data data, Map<String, Object> metadata) {
        return new AgentResponseData(data, MetadataValidator.requireJsonObject(metadata));
    }
}
