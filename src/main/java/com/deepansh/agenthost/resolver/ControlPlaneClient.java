package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.config.AgentHostProperties;
import com.deepansh.agenthost.config.HttpClientConfig;
import com.deepansh.agenthost.context.TraceHeaders;
import com.deepansh.agenthost.data.JsonCodec;
import com.deepansh.agenthost.exception.AgentException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP client for the control plane.
 *
 * Every call carries the JSON accept/content headers, the SDK user agent, W3C trace
 * context and the bearer token. Callers may override any header except Authorization.
 * A 429 is retried with exponential backoff; after the last attempt the 429 response is
 * returned as-is. Transport errors are never retried here.
 */
@Component
@Slf4j
public class ControlPlaneClient {

    private static final Set<Integer> JSON_STATUSES = Set.of(200, 201, 202);

    private final AgentHostProperties properties;
    private final RestClient.Builder builder;
    private final PoolingHttpClientConnectionManager connectionManager;
    private final RestClient defaultClient;
    private final Map<Duration, RestClient> clientsByTimeout = new ConcurrentHashMap<>();
    private final Retry retry;

    public ControlPlaneClient(AgentHostProperties properties,
                              @Qualifier("controlPlaneRestClientBuilder") RestClient.Builder builder,
                              PoolingHttpClientConnectionManager connectionManager) {
        this.properties = properties;
        this.builder = builder;
        this.connectionManager = connectionManager;
        this.defaultClient = builder.clone().build();

        AgentHostProperties.ControlPlane cp = properties.getControlPlane();
        RetryConfig config = RetryConfig.<ApiResponse>custom()
                .maxAttempts(Math.max(1, cp.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Math.max(1, cp.getBackoffMs()), 2.0))
                .retryOnResult(response -> response.status() == 429)
                .retryOnException(e -> false)
                .build();
        this.retry = Retry.of("controlPlane", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Control plane throttled, retrying [attempt={}, wait={}ms]",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
    }

    public ApiResponse get(String path) {
        return send(HttpMethod.GET, path, null, null, null);
    }

    public ApiResponse get(String path, Map<String, String> headers, Duration timeout) {
        return send(HttpMethod.GET, path, null, headers, timeout);
    }

    public ApiResponse post(String path, Object body) {
        return send(HttpMethod.POST, path, body, null, null);
    }

    public ApiResponse post(String path, Object body, Map<String, String> headers, Duration timeout) {
        return send(HttpMethod.POST, path, body, headers, timeout);
    }

    public ApiResponse put(String path, Object body, Map<String, String> headers, Duration timeout) {
        return send(HttpMethod.PUT, path, body, headers, timeout);
    }

    public ApiResponse delete(String path, Object body, Map<String, String> headers, Duration timeout) {
        return send(HttpMethod.DELETE, path, body, headers, timeout);
    }

    public ApiResponse send(HttpMethod method, String path, Object body,
                            Map<String, String> headers, Duration timeout) {
        String apiKey = properties.getControlPlane().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new AgentException("control plane API key is not set (agenthost.control-plane.api-key)");
        }
        URI uri = URI.create(properties.getControlPlane().getBaseUrl()).resolve(path);

        Map<String, String> merged = new LinkedHashMap<>();
        merged.put(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        merged.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        merged.put(HttpHeaders.USER_AGENT, "Agentuity Java SDK/" + properties.getSdkVersion());
        TraceHeaders.inject(merged);
        if (headers != null) {
            merged.putAll(headers);
        }
        merged.put(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);

        RestClient client = clientFor(timeout);
        log.debug("Control plane call: {} {}", method, uri);
        return retry.executeSupplier(() -> exchange(client, method, uri, body, merged));
    }

    private ApiResponse exchange(RestClient client, HttpMethod method, URI uri,
                                 Object body, Map<String, String> headers) {
        RestClient.RequestBodySpec spec = client.method(method)
                .uri(uri)
                .headers(h -> headers.forEach(h::set));
        if (body != null) {
            spec.body(body instanceof String ? body : JsonCodec.stringify(body));
        }
        return spec.exchange((request, response) -> {
            int status = response.getStatusCode().value();
            byte[] bytes = response.getBody().readAllBytes();
            MediaType contentType = response.getHeaders().getContentType();
            JsonNode json = null;
            if (JSON_STATUSES.contains(status) && bytes.length > 0
                    && contentType != null && contentType.getSubtype().contains("json")) {
                json = JsonCodec.mapper().readTree(bytes);
            }
            return new ApiResponse(status, json, new String(bytes, StandardCharsets.UTF_8), response.getHeaders());
        });
    }

    private RestClient clientFor(Duration timeout) {
        if (timeout == null || connectionManager == null
                || timeout.equals(properties.getControlPlane().getTimeout())) {
            return defaultClient;
        }
        return clientsByTimeout.computeIfAbsent(timeout, t -> builder.clone()
                .requestFactory(HttpClientConfig.requestFactory(connectionManager, t))
                .build());
    }
}
