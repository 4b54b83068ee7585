package com.sandy.aiot.vto.bridge.vo;

import com.sandy.aiot.vto.bridge.mqtt.ConnectionPhase;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Read-only snapshot of one tenant connection.
 */
@Value
@Builder
public class ConnectionStatus {
    String accountKey;
    ConnectionPhase phase;
    boolean connected;
    boolean running;
    int reconnectAttempts;
    long currentIntervalMs;
    LocalDateTime lastConnectTime;
    LocalDateTime lastDisconnectTime;
    LocalDateTime lastHeartbeatTime;
    int subscribedTopics;
}
