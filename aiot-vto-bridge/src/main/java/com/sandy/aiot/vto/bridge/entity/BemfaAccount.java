package com.sandy.aiot.vto.bridge.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A Bemfa cloud account. The private key is the MQTT client identifier of the account
 * and the uid of its push API calls.
 */
@Entity
@Table(name = "bemfa_accounts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BemfaAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @ToString.Exclude
    @Column(name = "account_key", nullable = false, unique = true, length = 100)
    private String accountKey;

    @Builder.Default
    private boolean enabled = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /** Key prefix safe to print in logs and status pages. */
    public String maskedKey() {
        return maskKey(accountKey);
    }

    public static String maskKey(String key) {
        if (key == null) return "null";
        return key.length() <= 8 ? key : key.substring(0, 8) + "...";
    }
}
