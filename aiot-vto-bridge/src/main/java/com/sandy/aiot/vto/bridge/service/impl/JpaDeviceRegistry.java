package com.sandy.aiot.vto.bridge.service.impl;

import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import com.sandy.aiot.vto.bridge.repository.VtoDeviceRepository;
import com.sandy.aiot.vto.bridge.service.DeviceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class JpaDeviceRegistry implements DeviceRegistry {

    private final VtoDeviceRepository deviceRepository;

    @Override
    @Transactional(readOnly = true)
    public List<VtoDevice> listVisibleDevices() {
        return deviceRepository.findByVisibleTrueAndTopicIsNotNull();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<VtoDevice> findDeviceByTopic(String topic) {
        if (topic == null) return Optional.empty();
        return deviceRepository.findFirstByTopic(topic);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<VtoDevice> findById(Long id) {
        if (id == null) return Optional.empty();
        return deviceRepository.findById(id);
    }

    @Override
    @Transactional
    public void recordActuation(Long deviceId, LocalDateTime timestamp) {
        deviceRepository.findById(deviceId).ifPresentOrElse(device -> {
            device.setLastUnlockTime(timestamp);
            deviceRepository.save(device);
        }, () -> log.warn("Cannot record unlock, device[id={}] no longer exists", deviceId));
    }
}
