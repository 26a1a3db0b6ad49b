package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.exception.RemoteInvocationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session lifecycle calls to the control plane.
 */
@Component
@RequiredArgsConstructor
public class SessionClient {

    static final String SESSION_COMPLETED_PATH = "/agent/2025-03-17/session-completed";

    private final ControlPlaneClient controlPlane;

    /**
     * Reports that every background task of {@code sessionId} has finished,
     * {@code duration} after the first one started.
     *
     * @throws RemoteInvocationException unless the control plane answers 202
     */
    public void markCompleted(String sessionId, Duration duration) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("duration", duration.toMillis());
        ApiResponse response = controlPlane.post(SESSION_COMPLETED_PATH, body);
        if (response.status() != 202) {
            throw new RemoteInvocationException(response.body());
        }
    }
}
