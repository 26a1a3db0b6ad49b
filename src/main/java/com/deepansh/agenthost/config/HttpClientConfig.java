package com.deepansh.agenthost.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * One pooled Apache HttpClient connection manager shared by every outbound call:
 * loopback hand-offs to co-located agents and control-plane requests.
 *
 * Clients built on top of the pool mark it shared, so closing a client never closes it.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public PoolingHttpClientConnectionManager agentConnectionManager(AgentHostProperties properties) {
        int max = properties.getLoopback().getMaxConnections();
        log.info("HTTP connection pool configured [maxTotal={}, maxPerRoute={}]", max, max);
        return PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(max)
                .setMaxConnPerRoute(max)
                .build();
    }

    /**
     * Builder for loopback calls. No response timeout: a co-located agent may stream for as
     * long as it likes.
     */
    @Bean("loopbackRestClientBuilder")
    public RestClient.Builder loopbackRestClientBuilder(PoolingHttpClientConnectionManager connectionManager) {
        return RestClient.builder().requestFactory(requestFactory(connectionManager, null));
    }

    @Bean("controlPlaneRestClientBuilder")
    public RestClient.Builder controlPlaneRestClientBuilder(PoolingHttpClientConnectionManager connectionManager,
                                                            AgentHostProperties properties) {
        Duration timeout = properties.getControlPlane().getTimeout();
        log.info("Control plane client configured [baseUrl={}, timeout={}ms]",
                properties.getControlPlane().getBaseUrl(), timeout.toMillis());
        return RestClient.builder().requestFactory(requestFactory(connectionManager, timeout));
    }

    /** Request factory over the shared pool; {@code responseTimeout} may be null for none. */
    public static HttpComponentsClientHttpRequestFactory requestFactory(
            PoolingHttpClientConnectionManager connectionManager, Duration responseTimeout) {
        RequestConfig.Builder requestConfig = RequestConfig.custom();
        if (responseTimeout != null) {
            requestConfig.setResponseTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()));
        }
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setConnectionManagerShared(true)
                .setDefaultRequestConfig(requestConfig.build())
                .build();
        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }
}
