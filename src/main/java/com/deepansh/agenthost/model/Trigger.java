package com.deepansh.agenthost.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** What caused an invocation. Serialized in lower case on the wire. */
public enum Trigger {
    WEBHOOK,
    CRON,
    MANUAL,
    AGENT,
    SMS,
    QUEUE,
    VOICE,
    EMAIL,
    DISCORD,
    SLACK,
    TELEGRAM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Trigger fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Trigger.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
