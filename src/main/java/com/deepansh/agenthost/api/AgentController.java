package com.deepansh.agenthost.api;

import com.deepansh.agenthost.context.TraceHeaders;
import com.deepansh.agenthost.data.Data;
import com.deepansh.agenthost.exception.DataFormatException;
import com.deepansh.agenthost.exception.UnknownAgentRouteException;
import com.deepansh.agenthost.model.AgentResponseEnvelope;
import com.deepansh.agenthost.model.AgentWelcome;
import com.deepansh.agenthost.model.InvocationRequest;
import com.deepansh.agenthost.model.Trigger;
import com.deepansh.agenthost.model.WireEncoding;
import com.deepansh.agenthost.resolver.CallbackRegistry;
import com.deepansh.agenthost.response.AgentResponseData;
import com.deepansh.agenthost.response.EnvelopeCodec;
import com.deepansh.agenthost.router.AgentRegistry;
import com.deepansh.agenthost.router.AgentRouter;
import com.fasterxml.jackson.databind.node.TextNode;
import io.opentelemetry.context.Scope;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Agent host endpoints.
 *
 * POST /{agentId}          invoke an agent with a JSON envelope
 * POST /run/{agentId}      invoke an agent with a raw body (trigger "manual")
 * POST /_reply/{replyId}   out-of-band reply for a pending remote invocation
 * GET  /welcome[/{id}]     greetings advertised by agents
 * GET  /_health            liveness
 * GET  /                   route help
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentRegistry registry;
    private final CallbackRegistry callbacks;

    @GetMapping("/_health")
    public ResponseEntity<Void> health() {
        return ResponseEntity.ok().build();
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String help() {
        StringBuilder sb = new StringBuilder("The following Agent routes are available:\n\n");
        registry.routes().forEach(router -> sb.append("POST /").append(router.agent().getId())
                .append(" - [").append(router.agent().getName()).append("]\n"));
        registry.routes().stream().findFirst().ifPresent(router -> sb.append("\nExample usage:\n\n")
                .append("curl http://localhost:3500/run/").append(router.agent().getId())
                .append(" \\\n\t--json '{\"message\":\"Hello, world!\"}'\n"));
        return sb.toString();
    }

    @PostMapping(value = "/_reply/{replyId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> reply(@PathVariable String replyId, @RequestBody AgentResponseEnvelope envelope) {
        AgentResponseData payload;
        try {
            payload = EnvelopeCodec.fromEnvelope(envelope, WireEncoding.BASE64);
        } catch (DataFormatException e) {
            // The waiter would otherwise sit out its full timeout.
            boolean failed = callbacks.failed(replyId, e);
            log.warn("Malformed reply {} [waiterFailed={}]: {}", replyId, failed, e.getMessage());
            throw e;
        }
        boolean delivered = callbacks.received(replyId, payload);
        log.debug("Reply {} received [delivered={}]", replyId, delivered);
        return ResponseEntity.ok().build();
    }

    @PostMapping(value = "/{agentId}", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AgentResponseEnvelope> run(@PathVariable String agentId,
                                                     @Valid @RequestBody InvocationRequest request,
                                                     @RequestHeader HttpHeaders headers) {
        AgentRouter router = routerFor(agentId);
        WireEncoding encoding = WireEncoding.forUserAgent(headers.getFirst(HttpHeaders.USER_AGENT));
        log.info("Agent run request [agentId={}, runId={}, trigger={}]",
                agentId, request.getRunId(), request.getTrigger());
        try (Scope ignored = TraceHeaders.extract(headers).makeCurrent()) {
            return ResponseEntity.ok(router.route(request, encoding));
        }
    }

    @PostMapping("/run/{agentId}")
    public ResponseEntity<byte[]> runManual(@PathVariable String agentId,
                                            @RequestBody(required = false) byte[] body,
                                            @RequestHeader HttpHeaders headers) {
        AgentRouter router = routerFor(agentId);
        MediaType requestType = headers.getContentType();
        Map<String, Object> headerMap = new LinkedHashMap<>();
        headers.forEach((name, values) -> headerMap.put(name, String.join(", ", values)));

        InvocationRequest request = InvocationRequest.builder()
                .trigger(Trigger.MANUAL)
                .contentType(requestType != null ? requestType.toString() : Data.OCTET_STREAM)
                .payload(new TextNode(Base64.getEncoder().encodeToString(body != null ? body : new byte[0])))
                .metadata(Map.of("headers", headerMap))
                .runId(UUID.randomUUID().toString())
                .build();
        log.info("Manual agent run [agentId={}, runId={}]", agentId, request.getRunId());

        AgentResponseEnvelope envelope;
        try (Scope ignored = TraceHeaders.extract(headers).makeCurrent()) {
            envelope = router.route(request, WireEncoding.BASE64);
        }
        byte[] payload = WireEncoding.BASE64.decode(envelope.getPayload());
        String contentType = envelope.getContentType() != null ? envelope.getContentType() : Data.TEXT_PLAIN;
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(contentType))
                .body(payload);
    }

    @GetMapping("/welcome")
    public Map<String, AgentWelcome> welcome() {
        Map<String, AgentWelcome> result = new LinkedHashMap<>();
        registry.routes().forEach(router -> router.handler().welcome()
                .ifPresent(welcome -> result.put(router.agent().getId(), welcome)));
        return result;
    }

    @GetMapping("/welcome/{agentId}")
    public ResponseEntity<AgentWelcome> welcome(@PathVariable String agentId) {
        return registry.find(agentId)
                .flatMap(router -> router.handler().welcome())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private AgentRouter routerFor(String agentId) {
        if (agentId.startsWith("_")) {
            throw new UnknownAgentRouteException("/" + agentId);
        }
        return registry.find(agentId).orElseThrow(() -> new UnknownAgentRouteException("/" + agentId));
    }
}
