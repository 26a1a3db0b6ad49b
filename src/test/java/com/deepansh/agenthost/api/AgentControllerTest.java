package com.deepansh.agenthost.api;

import com.deepansh.agenthost.config.AgentHostProperties;
import com.deepansh.agenthost.exception.GlobalExceptionHandler;
import com.deepansh.agenthost.handlers.EchoAgent;
import com.deepansh.agenthost.model.AgentConfig;
import com.deepansh.agenthost.resolver.AgentResolverFactory;
import com.deepansh.agenthost.resolver.SessionClient;
import com.deepansh.agenthost.resolver.CallbackRegistry;
import com.deepansh.agenthost.response.AgentResponseData;
import com.deepansh.agenthost.router.AgentRegistry;
import io.opentelemetry.api.trace.TracerProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AgentControllerTest {

    @Mock AgentResolverFactory resolverFactory;
    @Mock SessionClient sessions;

    private CallbackRegistry callbacks;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        AgentHostProperties props = new AgentHostProperties();
        props.setAgents(List.of(new AgentConfig("agent_echo", "echo", "echoes", "echo")));
        AgentRegistry registry = new AgentRegistry(props, Map.of("echo", new EchoAgent()),
                TracerProvider.noop().get("test"), resolverFactory, sessions, Runnable::run);
        callbacks = new CallbackRegistry();
        mvc = MockMvcBuilders.standaloneSetup(new AgentController(registry, callbacks))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void run_echoesBase64Payload() throws Exception {
        mvc.perform(post("/agent_echo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trigger\":\"webhook\",\"contentType\":\"text/plain\",\"payload\":\"aGk=\",\"runId\":\"r1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload").value("aGk="))
                .andExpect(jsonPath("$.contentType").value("text/plain"))
                .andExpect(jsonPath("$.trigger").value("webhook"))
                .andExpect(jsonPath("$.metadata.trigger").value("webhook"));
    }

    @Test
    void run_curlClient_usesPlainTextPayload() throws Exception {
        mvc.perform(post("/agent_echo")
                        .header("User-Agent", "curl/8.4.0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trigger\":\"manual\",\"contentType\":\"text/plain\",\"payload\":\"hi\",\"runId\":\"r1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload").value("hi"));
    }

    @Test
    void run_unknownAgent_returns404() throws Exception {
        mvc.perform(post("/agent_missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trigger\":\"webhook\",\"runId\":\"r1\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No Agent found at /agent_missing"));
    }

    @Test
    void run_underscorePath_isNotAnAgent() throws Exception {
        mvc.perform(post("/_internal")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trigger\":\"webhook\",\"runId\":\"r1\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void run_missingRunId_returns400() throws Exception {
        mvc.perform(post("/agent_echo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"trigger\":\"webhook\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("runId: runId must not be blank"));
    }

    @Test
    void run_malformedJson_returns400() throws Exception {
        mvc.perform(post("/agent_echo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void runManual_returnsRawPayloadWithContentType() throws Exception {
        mvc.perform(post("/run/agent_echo")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("hello"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("hello"));
    }

    @Test
    void reply_resolvesPendingInvocation() throws Exception {
        CompletableFuture<AgentResponseData> pending = callbacks.register("reply-1");

        mvc.perform(post("/_reply/reply-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":\"ZG9uZQ==\",\"contentType\":\"text/plain\"}"))
                .andExpect(status().isOk());

        assertThat(pending).isDone();
        assertThat(pending.join().data().text()).isEqualTo("done");
    }

    @Test
    void reply_unknownId_isAcceptedAndDropped() throws Exception {
        mvc.perform(post("/_reply/nobody")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":\"\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void reply_undecodablePayload_failsWaiterAndReturns400() throws Exception {
        CompletableFuture<AgentResponseData> pending = callbacks.register("reply-2");

        mvc.perform(post("/_reply/reply-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":\"@@not-base64@@\",\"contentType\":\"text/plain\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("base64")));

        assertThat(pending).isCompletedExceptionally();
        assertThat(callbacks.isPending("reply-2")).isFalse();
    }

    @Test
    void health_returns200() throws Exception {
        mvc.perform(get("/_health")).andExpect(status().isOk());
    }

    @Test
    void help_listsAgentRoutes() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("POST /agent_echo - [echo]")));
    }

    @Test
    void welcome_listsAgentsWithGreeting() throws Exception {
        mvc.perform(get("/welcome"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agent_echo.welcome").exists())
                .andExpect(jsonPath("$.agent_echo.prompts[0].contentType").value("text/plain"));
    }

    @Test
    void welcome_unknownAgent_returns404() throws Exception {
        mvc.perform(get("/welcome/nope")).andExpect(status().isNotFound());
    }
}
