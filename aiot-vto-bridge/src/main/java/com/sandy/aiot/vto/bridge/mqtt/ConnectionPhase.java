package com.sandy.aiot.vto.bridge.mqtt;

public enum ConnectionPhase {
    IDLE,
    CONNECTING,
    CONNECTED,
    /** Unexpected drop, no reconnect worker running yet (or the worker gave up). */
    DISCONNECTED,
    RECONNECTING,
    STOPPED
}
