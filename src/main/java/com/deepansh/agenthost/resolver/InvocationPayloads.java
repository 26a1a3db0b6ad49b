package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.context.ContextScope;
import com.deepansh.agenthost.context.ContextScopes;
import com.deepansh.agenthost.data.Data;
import com.deepansh.agenthost.model.InvocationArguments;
import com.deepansh.agenthost.model.InvocationRequest;
import com.deepansh.agenthost.model.Trigger;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.UUID;

/** Turns outbound invocation arguments into the wire request both invokers send. */
final class InvocationPayloads {

    private InvocationPayloads() {
    }

    static InvocationRequest toRequest(Trigger trigger, InvocationArguments args) {
        Object value = args != null ? args.getData() : null;
        String contentType = args != null ? args.getContentType() : null;
        Data data = Data.from(value, contentType);
        String runId = ContextScopes.find()
                .map(ContextScope::getRunId)
                .orElseGet(() -> UUID.randomUUID().toString());
        return InvocationRequest.builder()
                .trigger(trigger)
                .contentType(data.contentType())
                .payload(new TextNode(data.base64()))
                .metadata(args != null ? args.getMetadata() : null)
                .runId(runId)
                .build();
    }
}
