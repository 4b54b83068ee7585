package com.sandy.aiot.vto.bridge.mqtt;

import com.sandy.aiot.vto.bridge.config.BridgeProperties;
import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import com.sandy.aiot.vto.bridge.service.AccountRegistry;
import com.sandy.aiot.vto.bridge.service.DeviceRegistry;
import com.sandy.aiot.vto.bridge.service.RemoteTopicSync;
import com.sandy.aiot.vto.bridge.service.impl.DoorCommandHandler;
import com.sandy.aiot.vto.bridge.vo.ConnectionStatus;
import com.sandy.aiot.vto.bridge.vo.TopicSyncSummary;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Owns one {@link TenantConnection} per enabled account and keeps the set aligned with the
 * account registry.
 */
@Service
@Slf4j
public class ConnectionSupervisor {

    private final BridgeProperties properties;
    private final AccountRegistry accountRegistry;
    private final DeviceRegistry deviceRegistry;
    private final RemoteTopicSync remoteTopicSync;
    private final BrokerSessionFactory sessionFactory;
    private final DoorCommandHandler commandHandler;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    // guarded by lock
    private final Map<String, TenantConnection> connections = new LinkedHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean remoteSyncDone = new AtomicBoolean(false);

    public ConnectionSupervisor(BridgeProperties properties,
                                AccountRegistry accountRegistry,
                                DeviceRegistry deviceRegistry,
                                RemoteTopicSync remoteTopicSync,
                                BrokerSessionFactory sessionFactory,
                                DoorCommandHandler commandHandler,
                                Clock clock) {
        this.properties = properties;
        this.accountRegistry = accountRegistry;
        this.deviceRegistry = deviceRegistry;
        this.remoteTopicSync = remoteTopicSync;
        this.sessionFactory = sessionFactory;
        this.commandHandler = commandHandler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getMqtt().isEnabled()) {
            log.info("MQTT bridge disabled (bridge.mqtt.enabled=false)");
            return;
        }
        long delayMs = properties.getMqtt().getStartupDelay().toMillis();
        Thread starter = new Thread(() -> {
            try {
                Thread.sleep(delayMs);
                startAll();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("MQTT bridge startup interrupted");
            } catch (RuntimeException e) {
                log.error("MQTT bridge startup failed: {}", e.getMessage(), e);
            }
        }, "vto-bridge-startup");
        starter.setDaemon(true);
        starter.start();
        log.info("MQTT bridge will start in {} ms", delayMs);
    }

    /**
     * Starts (or restarts) one connection per enabled account. The first call in the process
     * aligns the remote topic catalogue of every account beforehand.
     */
    public void startAll() {
        List<BemfaAccount> accounts = loadAccounts();
        if (remoteSyncDone.compareAndSet(false, true)) {
            accounts.forEach(account -> syncRemoteTopics(account.getAccountKey()));
        }
        lock.lock();
        try {
            started.set(true);
            for (BemfaAccount account : accounts) {
                String key = account.getAccountKey();
                TenantConnection existing = connections.remove(key);
                if (existing != null) {
                    existing.stop();
                }
                openConnection(key);
            }
        } finally {
            lock.unlock();
        }
        log.info("MQTT bridge started with {} account connection(s)", accounts.size());
    }

    @Scheduled(fixedDelayString = "${bridge.supervisor.reconcile-interval:PT60S}",
            initialDelayString = "${bridge.supervisor.reconcile-interval:PT60S}")
    public void reconcile() {
        if (!started.get()) {
            log.debug("Supervisor not started, reconcile skipped");
            return;
        }
        Set<String> desired;
        try {
            desired = accountRegistry.listEnabledAccounts().stream()
                    .map(BemfaAccount::getAccountKey)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } catch (RuntimeException e) {
            log.error("Cannot load enabled accounts, reconcile skipped: {}", e.getMessage());
            return;
        }
        lock.lock();
        try {
            if (!started.get()) {
                return;
            }
            List<String> obsolete = new ArrayList<>();
            for (String key : connections.keySet()) {
                if (!desired.contains(key)) {
                    obsolete.add(key);
                }
            }
            for (String key : obsolete) {
                log.info("Account {} no longer enabled, stopping its connection", BemfaAccount.maskKey(key));
                connections.remove(key).stop();
            }
            for (String key : desired) {
                if (!connections.containsKey(key)) {
                    log.info("Account {} enabled, starting its connection", BemfaAccount.maskKey(key));
                    openConnection(key);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void stopAll() {
        lock.lock();
        try {
            started.set(false);
            for (TenantConnection connection : connections.values()) {
                try {
                    connection.stop();
                } catch (RuntimeException e) {
                    log.warn("Error stopping connection {}: {}",
                            BemfaAccount.maskKey(connection.getAccountKey()), e.getMessage());
                }
            }
            if (!connections.isEmpty()) {
                log.info("Stopped {} account connection(s)", connections.size());
            }
            connections.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false when a running connection already exists for the key
     */
    public boolean startConnection(String accountKey) {
        if (accountKey == null || accountKey.isBlank()) {
            return false;
        }
        lock.lock();
        try {
            TenantConnection existing = connections.get(accountKey);
            if (existing != null && existing.getStatus().isRunning()) {
                log.info("Connection for account {} already running", BemfaAccount.maskKey(accountKey));
                return false;
            }
            if (existing != null) {
                connections.remove(accountKey).stop();
            }
            openConnection(accountKey);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean stopConnection(String accountKey) {
        lock.lock();
        try {
            TenantConnection connection = connections.remove(accountKey);
            if (connection == null) {
                return false;
            }
            connection.stop();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void subscribeTopic(String topic) {
        for (TenantConnection connection : snapshot()) {
            try {
                connection.subscribe(topic);
            } catch (RuntimeException e) {
                log.error("{} - Subscribe to {} failed: {}",
                        BemfaAccount.maskKey(connection.getAccountKey()), topic, e.getMessage());
            }
        }
    }

    public void unsubscribeTopic(String topic) {
        for (TenantConnection connection : snapshot()) {
            try {
                connection.unsubscribe(topic);
            } catch (RuntimeException e) {
                log.error("{} - Unsubscribe from {} failed: {}",
                        BemfaAccount.maskKey(connection.getAccountKey()), topic, e.getMessage());
            }
        }
    }

    /**
     * Re-aligns remote catalogues and subscriptions after the set of visible devices changed.
     */
    public void refreshTopics() {
        for (BemfaAccount account : loadAccounts()) {
            syncRemoteTopics(account.getAccountKey());
        }
        Set<String> visible;
        try {
            visible = deviceRegistry.listVisibleDevices().stream()
                    .map(VtoDevice::getTopic)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } catch (RuntimeException e) {
            log.error("Cannot load visible devices, topic refresh skipped: {}", e.getMessage());
            return;
        }
        for (TenantConnection connection : snapshot()) {
            try {
                visible.forEach(connection::subscribe);
                for (String topic : connection.getSubscribedTopics()) {
                    if (!visible.contains(topic)) {
                        connection.unsubscribe(topic);
                    }
                }
            } catch (RuntimeException e) {
                log.error("{} - Topic refresh failed: {}",
                        BemfaAccount.maskKey(connection.getAccountKey()), e.getMessage());
            }
        }
        log.info("Topic refresh done, {} visible topic(s)", visible.size());
    }

    public boolean isConnected() {
        return snapshot().stream().anyMatch(TenantConnection::isConnected);
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * @return status per account key, in start order
     */
    public Map<String, ConnectionStatus> getStatus() {
        Map<String, ConnectionStatus> status = new LinkedHashMap<>();
        for (TenantConnection connection : snapshot()) {
            status.put(connection.getAccountKey(), connection.getStatus());
        }
        return Collections.unmodifiableMap(status);
    }

    protected TenantConnection createConnection(String accountKey) {
        return new TenantConnection(accountKey, properties, sessionFactory, deviceRegistry, commandHandler,
                ReachabilityProbe.tcp(), BackoffPolicy.from(properties.getReconnect()), clock);
    }

    // caller holds lock
    private void openConnection(String accountKey) {
        TenantConnection connection = createConnection(accountKey);
        connections.put(accountKey, connection);
        try {
            connection.start();
        } catch (RuntimeException e) {
            log.error("Cannot start connection for account {}: {}", BemfaAccount.maskKey(accountKey), e.getMessage(), e);
        }
    }

    private List<TenantConnection> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(connections.values());
        } finally {
            lock.unlock();
        }
    }

    private List<BemfaAccount> loadAccounts() {
        try {
            return accountRegistry.listEnabledAccounts();
        } catch (RuntimeException e) {
            log.error("Cannot load enabled accounts: {}", e.getMessage());
            return List.of();
        }
    }

    private void syncRemoteTopics(String accountKey) {
        try {
            TopicSyncSummary summary = remoteTopicSync.reconcileRemoteTopics(accountKey);
            if (summary.hasChanges() || summary.getFailed() > 0) {
                log.info("Remote topics of {} aligned: {}", BemfaAccount.maskKey(accountKey), summary);
            }
        } catch (RuntimeException e) {
            log.error("Remote topic sync of {} failed: {}", BemfaAccount.maskKey(accountKey), e.getMessage());
        }
    }
}
