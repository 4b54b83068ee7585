package com.sandy.aiot.vto.bridge.entity;

import com.sandy.aiot.vto.bridge.tools.DeviceTopics;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Objects;

@Entity
@Table(name = "vto_devices")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VtoDevice {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    private String name;
    @Column(nullable = false, length = 50)
    private String address; // e.g., "172.16.11.1"
    @Builder.Default
    private String username = "admin";
    @ToString.Exclude
    @Builder.Default
    private String password = "admin123";
    @Column(unique = true, length = 100)
    private String topic; // derived from address, see DeviceTopics
    private boolean visible;
    private LocalDateTime lastUnlockTime;
    private LocalDateTime createdAt;

    @PrePersist
    @PreUpdate
    void deriveTopic() {
        topic = DeviceTopics.deriveTopic(address);
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        VtoDevice device = (VtoDevice) o;
        return Objects.equals(id, device.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
