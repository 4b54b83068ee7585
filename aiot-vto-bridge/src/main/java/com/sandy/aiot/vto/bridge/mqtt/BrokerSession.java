package com.sandy.aiot.vto.bridge.mqtt;

import java.util.concurrent.CompletableFuture;

/**
 * One MQTT session of one account. A session connects at most once; reconnecting means
 * creating a new session.
 */
public interface BrokerSession {

    /**
     * Starts connecting and returns immediately; the outcome is reported to the listener.
     */
    void connect();

    /**
     * Closes the session. Waits a bounded time for the broker to acknowledge.
     */
    void disconnect();

    CompletableFuture<Void> subscribe(String topic);

    CompletableFuture<Void> unsubscribe(String topic);

    boolean isConnected();
}
