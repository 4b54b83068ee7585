package com.sandy.aiot.vto.bridge.mqtt;

/**
 * Callbacks of a {@link BrokerSession}. Every callback carries the session that raised it,
 * so a listener that replaced its session can ignore late events of the old one.
 */
public interface BrokerSessionListener {

    void onConnected(BrokerSession source);

    void onConnectFailed(BrokerSession source, Throwable cause);

    /**
     * Called on the single inbound thread of the session, one message at a time.
     */
    void onMessage(BrokerSession source, String topic, byte[] payload);

    void onDisconnected(BrokerSession source, Throwable cause, boolean userInitiated);

    /**
     * Proof of life from the broker: connect ack, subscription ack, inbound traffic or a
     * keep-alive tick while the client is connected.
     */
    void onHeartbeat(BrokerSession source);
}
