package com.deepansh.agenthost.data;

import com.deepansh.agenthost.exception.DataFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.nio.charset.StandardCharsets;

/**
 * Shared Jackson mapper for payload values that live outside the Spring context
 * (Data containers, stream chunks, envelopes built on worker threads).
 */
public final class JsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectReader STRICT_READER = MAPPER.readerFor(JsonNode.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Tree reader that rejects anything after the first JSON value. */
    public static ObjectReader strictReader() {
        return STRICT_READER;
    }

    public static String stringify(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DataFormatException("value is not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    public static byte[] toBytes(Object value) {
        return stringify(value).getBytes(StandardCharsets.UTF_8);
    }
}
