package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.exception.RemoteInvocationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionClientTest {

    @Mock ControlPlaneClient controlPlane;
    @InjectMocks SessionClient sessions;

    @Test
    void markCompleted_postsSessionAndDuration() {
        when(controlPlane.post(eq(SessionClient.SESSION_COMPLETED_PATH), any()))
                .thenReturn(new ApiResponse(202, null, "", null));

        sessions.markCompleted("sess_run_1", Duration.ofMillis(1500));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
        verify(controlPlane).post(eq("/agent/2025-03-17/session-completed"), body.capture());
        assertThat(body.getValue())
                .containsEntry("sessionId", "sess_run_1")
                .containsEntry("duration", 1500L);
    }

    @Test
    void markCompleted_anyOtherStatus_failsWithResponseBody() {
        when(controlPlane.post(eq(SessionClient.SESSION_COMPLETED_PATH), any()))
                .thenReturn(new ApiResponse(500, null, "session store unavailable", null));

        assertThatThrownBy(() -> sessions.markCompleted("sess_run_1", Duration.ZERO))
                .isInstanceOf(RemoteInvocationException.class)
                .hasMessage("session store unavailable");
    }
}
