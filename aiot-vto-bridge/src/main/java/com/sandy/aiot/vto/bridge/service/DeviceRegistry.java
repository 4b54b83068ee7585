package com.sandy.aiot.vto.bridge.service;

import com.sandy.aiot.vto.bridge.entity.VtoDevice;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Read access to door stations plus the single write the bridge performs on them.
 */
public interface DeviceRegistry {

    /**
     * Devices whose command topic should be subscribed on every account connection.
     */
    List<VtoDevice> listVisibleDevices();

    Optional<VtoDevice> findDeviceByTopic(String topic);

    Optional<VtoDevice> findById(Long id);

    /**
     * Stores the time of the last successful unlock of a device.
     */
    void recordActuation(Long deviceId, LocalDateTime timestamp);
}
