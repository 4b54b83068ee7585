package com.sandy.aiot.vto.bridge.service;

import com.sandy.aiot.vto.bridge.vo.PushbackResult;

/**
 * Pushes a device status message to a cloud account. Implementations report failures
 * through the result code and never throw.
 */
public interface PushbackSender {
    PushbackResult sendStatus(String accountKey, String topic, String status, String humanMessage);
}
