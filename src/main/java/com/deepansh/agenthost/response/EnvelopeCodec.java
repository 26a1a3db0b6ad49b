package com.deepansh.agenthost.response;

import com.deepansh.agenthost.data.Data;
import com.deepansh.agenthost.data.JsonCodec;
import com.deepansh.agenthost.exception.DataFormatException;
import com.deepansh.agenthost.model.AgentResponseEnvelope;
import com.deepansh.agenthost.model.InvocationRequest;
import com.deepansh.agenthost.model.WireEncoding;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts between wire envelopes and {@link Data} containers.
 */
public final class EnvelopeCodec {

    private EnvelopeCodec() {
    }

    /**
     * Request payload as a container. A string payload is decoded with {@code encoding};
     * a JSON object or array is taken as JSON bytes.
     */
    public static Data requestData(InvocationRequest request, WireEncoding encoding) {
        JsonNode payload = request.getPayload();
        String contentType = request.getContentType();
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return Data.empty(contentType != null ? contentType : Data.TEXT_PLAIN);
        }
        if (payload.isTextual()) {
            return Data.of(decode(payload.asText(), encoding), contentType != null ? contentType : Data.OCTET_STREAM);
        }
        return Data.of(JsonCodec.toBytes(payload), contentType != null ? contentType : Data.APPLICATION_JSON);
    }

    public static AgentResponseEnvelope toEnvelope(String trigger, AgentResponseData response, WireEncoding encoding) {
        Data data = response.data();
        return AgentResponseEnvelope.builder()
                .trigger(trigger)
                .payload(encoding.encode(data.binary()))
                .contentType(data.contentType())
                .metadata(response.metadata())
                .build();
    }

    public static AgentResponseData fromEnvelope(AgentResponseEnvelope envelope, WireEncoding encoding) {
        String contentType = envelope.getContentType() != null ? envelope.getContentType() : Data.TEXT_PLAIN;
        return new AgentResponseData(
                Data.of(decode(envelope.getPayload(), encoding), contentType),
                envelope.getMetadata());
    }

    private static byte[] decode(String payload, WireEncoding encoding) {
        try {
            return encoding.decode(payload);
        } catch (IllegalArgumentException e) {
            throw new DataFormatException("payload is not valid " + encoding.name().toLowerCase(), e);
        }
    }
}
