package com.deepansh.agenthost.context;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AgentLoggerTest {

    private Logger logbackLogger;
    private RecordingAppender appender;

    @BeforeEach
    void setUp() {
        logbackLogger = (Logger) LoggerFactory.getLogger(AgentLoggerTest.class);
        logbackLogger.setLevel(Level.DEBUG);
        appender = new RecordingAppender();
        appender.start();
        logbackLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logbackLogger.detachAppender(appender);
        MDC.clear();
    }

    @Test
    void child_mergesContext_withoutChangingParent() {
        AgentLogger parent = AgentLogger.of(AgentLoggerTest.class).child(Map.of("agentId", "a"));

        AgentLogger child = parent.child(Map.of("runId", "r1"));

        assertThat(child.context()).containsEntry("agentId", "a").containsEntry("runId", "r1");
        assertThat(parent.context()).containsOnlyKeys("agentId");
    }

    @Test
    void logCall_carriesContextInMdc_andRestoresAfter() {
        MDC.put("runId", "outer");

        AgentLogger.of(AgentLoggerTest.class).child(Map.of("runId", "inner")).info("hello {}", "world");

        assertThat(appender.messages).containsExactly("hello world");
        assertThat(appender.mdc.get(0)).containsEntry("runId", "inner");
        assertThat(MDC.get("runId")).isEqualTo("outer");
    }

    @Test
    void debug_belowLevel_isSkipped() {
        logbackLogger.setLevel(Level.INFO);

        AgentLogger.of(AgentLoggerTest.class).debug("quiet");

        assertThat(appender.messages).isEmpty();
    }

    // MDC is read at append time; the event itself copies it lazily.
    private static class RecordingAppender extends AppenderBase<ILoggingEvent> {
        final List<String> messages = new ArrayList<>();
        final List<Map<String, String>> mdc = new ArrayList<>();

        @Override
        protected void append(ILoggingEvent event) {
            messages.add(event.getFormattedMessage());
            mdc.add(Map.copyOf(MDC.getCopyOfContextMap()));
        }
    }
}
