package com.deepansh.agenthost.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * What to send to another agent. Every field is optional.
 *
 * {@code data} may be a {@link String}, {@code byte[]}, {@link java.nio.ByteBuffer},
 * a {@link com.deepansh.agenthost.data.Data} container, or any JSON-serializable value.
 */
@Value
@Builder
public class InvocationArguments {

    Object data;
    String contentType;
    Map<String, Object> metadata;

    public static InvocationArguments of(Object data) {
        return InvocationArguments.builder().data(data).build();
    }
}
