package com.sandy.aiot.vto.bridge.repository;

import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VtoDeviceRepository extends JpaRepository<VtoDevice, Long> {
    List<VtoDevice> findByVisibleTrueAndTopicIsNotNull();
    Optional<VtoDevice> findFirstByTopic(String topic);
}
