package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.context.AgentLogger;
import com.deepansh.agenthost.data.Data;
import com.deepansh.agenthost.data.JsonCodec;
import com.deepansh.agenthost.exception.AgentLoopException;
import com.deepansh.agenthost.exception.AgentNotFoundException;
import com.deepansh.agenthost.exception.RemoteInvocationException;
import com.deepansh.agenthost.exception.ReplyTimeoutException;
import com.deepansh.agenthost.model.AgentConfig;
import com.deepansh.agenthost.model.AgentReference;
import com.deepansh.agenthost.model.InvocationArguments;
import com.deepansh.agenthost.response.AgentResponseData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentResolverTest {

    private static final List<AgentConfig> LOCAL_AGENTS = List.of(
            new AgentConfig("agent_self", "self", "the caller", "selfHandler"),
            new AgentConfig("agent_helper", "helper", "co-located helper", "helperHandler"));

    @Mock ControlPlaneClient controlPlane;
    @Mock RestClient loopbackClient;

    private CallbackRegistry callbacks;

    @BeforeEach
    void setUp() {
        callbacks = new CallbackRegistry();
    }

    @Test
    void resolve_currentAgentById_isLoop_withoutNetwork() {
        AgentResolver resolver = resolver(Duration.ofSeconds(1));

        assertThatThrownBy(() -> resolver.resolve(AgentReference.byId("agent_self")))
                .isInstanceOf(AgentLoopException.class)
                .hasMessageContaining("agent_self");
        verifyNoInteractions(controlPlane, loopbackClient);
    }

    @Test
    void resolve_currentAgentByName_isLoop_withoutNetwork() {
        AgentResolver resolver = resolver(Duration.ofSeconds(1));

        assertThatThrownBy(() -> resolver.resolve(AgentReference.byName("self", "proj_1")))
                .isInstanceOf(AgentLoopException.class);
        verifyNoInteractions(controlPlane, loopbackClient);
    }

    @Test
    void resolve_localAgent_returnsLocalInvoker() {
        RemoteAgent agent = resolver(Duration.ofSeconds(1)).resolve(AgentReference.byName("helper"));

        assertThat(agent).isInstanceOf(LocalAgentInvoker.class);
        assertThat(agent.id()).isEqualTo("agent_helper");
        assertThat(agent.projectId()).isEqualTo("proj_1");
        verifyNoInteractions(controlPlane);
    }

    @Test
    void resolve_otherProject_skipsLocalAgents() throws Exception {
        when(controlPlane.post(eq("/sdk/agent/resolve"), any()))
                .thenReturn(json(200, "{\"success\":true,\"data\":{\"id\":\"agent_far\",\"name\":\"helper\","
                        + "\"projectId\":\"proj_2\"}}"));

        RemoteAgent agent = resolver(Duration.ofSeconds(1)).resolve(AgentReference.byName("helper", "proj_2"));

        assertThat(agent).isInstanceOf(RemoteAgentInvoker.class);
        assertThat(agent.projectId()).isEqualTo("proj_2");
    }

    @Test
    void resolve_notFoundById_namesTheId() throws Exception {
        when(controlPlane.post(eq("/sdk/agent/resolve"), any())).thenReturn(json(404, null));

        assertThatThrownBy(() -> resolver(Duration.ofSeconds(1)).resolve(AgentReference.byId("agent_x")))
                .isInstanceOf(AgentNotFoundException.class)
                .hasMessage("agent agent_x not found or you don't have access to it");
    }

    @Test
    void resolve_notFoundByName_namesTheName() throws Exception {
        when(controlPlane.post(eq("/sdk/agent/resolve"), any())).thenReturn(json(404, null));

        assertThatThrownBy(() -> resolver(Duration.ofSeconds(1)).resolve(AgentReference.byName("ghost")))
                .isInstanceOf(AgentNotFoundException.class)
                .hasMessageContaining("agent named ghost");
    }

    @Test
    void resolve_unsuccessful_usesServerMessage() throws Exception {
        when(controlPlane.post(eq("/sdk/agent/resolve"), any()))
                .thenReturn(json(200, "{\"success\":false,\"message\":\"quota exceeded\"}"));

        assertThatThrownBy(() -> resolver(Duration.ofSeconds(1)).resolve(AgentReference.byName("far")))
                .isInstanceOf(RemoteInvocationException.class)
                .hasMessage("quota exceeded");
    }

    @Test
    void resolve_remoteResolvesToSelf_isLoop() throws Exception {
        when(controlPlane.post(eq("/sdk/agent/resolve"), any()))
                .thenReturn(json(200, "{\"success\":true,\"data\":{\"id\":\"agent_self\"}}"));

        assertThatThrownBy(() -> resolver(Duration.ofSeconds(1)).resolve(AgentReference.byName("alias")))
                .isInstanceOf(AgentLoopException.class);
    }

    @Test
    void remoteRun_waitsForReplyDelivery() throws Exception {
        RemoteAgent agent = remoteAgent(Duration.ofSeconds(5));
        AgentResponseData reply = new AgentResponseData(Data.of("done", "text/plain"));
        when(controlPlane.post(startsWith("/sdk/agent/agent_far/run/"), any())).thenAnswer(invocation -> {
            String path = invocation.getArgument(0);
            String replyId = path.substring(path.lastIndexOf('/') + 1);
            // Delivered before the acknowledgement returns.
            callbacks.received(replyId, reply);
            return json(200, "{\"success\":true}");
        });

        AgentResponseData result = agent.run(InvocationArguments.of("hello"));

        assertThat(result).isSameAs(reply);
        assertThat(callbacks.pendingCount()).isZero();
    }

    @Test
    void remoteRun_rejected_cancelsRegistration() throws Exception {
        RemoteAgent agent = remoteAgent(Duration.ofSeconds(5));
        when(controlPlane.post(startsWith("/sdk/agent/agent_far/run/"), any()))
                .thenReturn(json(200, "{\"success\":false}"));

        assertThatThrownBy(() -> agent.run(null))
                .isInstanceOf(RemoteInvocationException.class)
                .hasMessage("unknown error from agent response");
        assertThat(callbacks.pendingCount()).isZero();
    }

    @Test
    void remoteRun_noReply_timesOutAndDropsEntry() throws Exception {
        RemoteAgent agent = remoteAgent(Duration.ofMillis(50));
        when(controlPlane.post(startsWith("/sdk/agent/agent_far/run/"), any()))
                .thenReturn(json(202, "{\"success\":true}"));

        assertThatThrownBy(() -> agent.run(InvocationArguments.of("hello")))
                .isInstanceOf(ReplyTimeoutException.class)
                .hasMessageContaining("agent_far");
        assertThat(callbacks.pendingCount()).isZero();
    }

    private RemoteAgent remoteAgent(Duration replyTimeout) throws Exception {
        when(controlPlane.post(eq("/sdk/agent/resolve"), any()))
                .thenReturn(json(200, "{\"success\":true,\"data\":{\"id\":\"agent_far\",\"name\":\"far\"}}"));
        RemoteAgent agent = resolver(replyTimeout).resolve(AgentReference.byName("far"));
        verify(controlPlane).post(eq("/sdk/agent/resolve"), any());
        return agent;
    }

    private AgentResolver resolver(Duration replyTimeout) {
        return new AgentResolver("agent_self", LOCAL_AGENTS, "proj_1", "http://127.0.0.1:3500",
                loopbackClient, controlPlane, callbacks, replyTimeout, AgentLogger.of(AgentResolverTest.class));
    }

    private static ApiResponse json(int status, String body) throws Exception {
        return new ApiResponse(status, body == null ? null : JsonCodec.mapper().readTree(body),
                body == null ? "" : body, new HttpHeaders());
    }
}
