package com.sandy.aiot.vto.bridge.vo;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What happened to one inbound broker message. Pushback results are keyed by masked account key.
 */
@Data
@Builder
public class CommandOutcome {

    public enum Status {
        UNKNOWN_TOPIC,
        NOT_AN_OPEN_COMMAND,
        ACTUATION_FAILED,
        UNLOCKED
    }

    private Status status;
    private String topic;
    private DoorOpenResult doorOpenResult;
    @Builder.Default
    private Map<String, PushbackResult> pushback = new LinkedHashMap<>();

    public static CommandOutcome of(Status status, String topic) {
        return CommandOutcome.builder().status(status).topic(topic).build();
    }
}
