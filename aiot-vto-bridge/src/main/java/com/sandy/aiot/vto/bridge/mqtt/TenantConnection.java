package com.sandy.aiot.vto.bridge.mqtt;

import com.sandy.aiot.vto.bridge.config.BridgeProperties;
import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import com.sandy.aiot.vto.bridge.service.DeviceRegistry;
import com.sandy.aiot.vto.bridge.service.impl.DoorCommandHandler;
import com.sandy.aiot.vto.bridge.vo.ConnectionStatus;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one account connected to the broker with every visible device topic subscribed.
 * <p>
 * Unexpected drops (lost connection, failed connect, stale heartbeat, client reporting not
 * connected) move the connection to {@link ConnectionPhase#DISCONNECTED} and schedule exactly
 * one reconnect worker, which retries with jittered backoff until connected, stopped or out of
 * attempts. A health thread checks the connection periodically. {@link #stop()} is the only
 * way to cancel: it raises a flag observed by every wait and joins both threads with a bound.
 */
@Slf4j
public class TenantConnection implements BrokerSessionListener {

    private final String accountKey;
    private final String tenant;
    private final BridgeProperties properties;
    private final BrokerSessionFactory sessionFactory;
    private final DeviceRegistry deviceRegistry;
    private final DoorCommandHandler commandHandler;
    private final ReachabilityProbe probe;
    private final BackoffPolicy backoff;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicBoolean autoReconnect;
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicInteger reconnectWorkersSpawned = new AtomicInteger();
    private final Set<String> subscribedTopics = ConcurrentHashMap.newKeySet();

    private volatile ConnectionPhase phase = ConnectionPhase.IDLE;
    private volatile BrokerSession session;
    private volatile Instant lastHeartbeat;
    private volatile LocalDateTime lastConnectTime;
    private volatile LocalDateTime lastDisconnectTime;
    private volatile boolean attemptsExhausted;

    // guarded by lock
    private boolean attemptFailed;
    private Thread reconnectThread;
    private Thread healthThread;

    public TenantConnection(String accountKey,
                            BridgeProperties properties,
                            BrokerSessionFactory sessionFactory,
                            DeviceRegistry deviceRegistry,
                            DoorCommandHandler commandHandler,
                            ReachabilityProbe probe,
                            BackoffPolicy backoff,
                            Clock clock) {
        this.accountKey = accountKey;
        this.tenant = BemfaAccount.maskKey(accountKey);
        this.properties = properties;
        this.sessionFactory = sessionFactory;
        this.deviceRegistry = deviceRegistry;
        this.commandHandler = commandHandler;
        this.probe = probe;
        this.backoff = backoff;
        this.clock = clock;
        this.autoReconnect = new AtomicBoolean(properties.getReconnect().isAutoReconnect());
        this.lastHeartbeat = clock.instant();
    }

    public void start() {
        if (stopping.get()) {
            log.warn("{} - Connection already stopped, start ignored", tenant);
            return;
        }
        if (!started.compareAndSet(false, true)) {
            log.info("{} - Connection already started", tenant);
            return;
        }
        BridgeProperties.Mqtt mqtt = properties.getMqtt();
        log.info("{} - Connecting to {}:{}", tenant, mqtt.getHost(), mqtt.getPort());
        BrokerSession fresh = sessionFactory.create(accountKey, this);
        lock.lock();
        try {
            phase = ConnectionPhase.CONNECTING;
            lastHeartbeat = clock.instant();
            session = fresh;
        } finally {
            lock.unlock();
        }
        connectSession(fresh);

        Thread health = new Thread(this::healthLoop, "vto-health-" + tenant);
        health.setDaemon(true);
        lock.lock();
        try {
            healthThread = health;
        } finally {
            lock.unlock();
        }
        health.start();
    }

    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        autoReconnect.set(false);
        Thread worker;
        Thread health;
        lock.lock();
        try {
            phase = ConnectionPhase.STOPPED;
            worker = reconnectThread;
            health = healthThread;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        closeQuietly(session);
        subscribedTopics.clear();
        join(worker, "reconnect");
        join(health, "health check");
        log.info("{} - Connection stopped", tenant);
    }

    /**
     * Subscribes one topic. No-op unless connected or when already subscribed; a rejected
     * subscription is forgotten so that it can be retried.
     */
    public void subscribe(String topic) {
        if (topic == null || topic.isBlank()) {
            return;
        }
        BrokerSession current = session;
        if (phase != ConnectionPhase.CONNECTED || current == null) {
            log.debug("{} - Not connected, subscribe of {} skipped", tenant, topic);
            return;
        }
        if (!subscribedTopics.add(topic)) {
            return;
        }
        try {
            current.subscribe(topic).whenComplete((ignored, throwable) -> {
                if (throwable != null) {
                    subscribedTopics.remove(topic);
                    log.error("{} - Subscribe to {} failed: {}", tenant, topic, throwable.getMessage());
                } else {
                    log.info("{} - Subscribed to {}", tenant, topic);
                }
            });
        } catch (RuntimeException e) {
            subscribedTopics.remove(topic);
            log.error("{} - Subscribe to {} failed: {}", tenant, topic, e.getMessage());
        }
    }

    public void unsubscribe(String topic) {
        if (topic == null || topic.isBlank()) {
            return;
        }
        BrokerSession current = session;
        if (phase != ConnectionPhase.CONNECTED || current == null) {
            log.debug("{} - Not connected, unsubscribe of {} skipped", tenant, topic);
            return;
        }
        if (!subscribedTopics.remove(topic)) {
            return;
        }
        try {
            current.unsubscribe(topic).whenComplete((ignored, throwable) -> {
                if (throwable != null) {
                    log.warn("{} - Unsubscribe from {} failed: {}", tenant, topic, throwable.getMessage());
                } else {
                    log.info("{} - Unsubscribed from {}", tenant, topic);
                }
            });
        } catch (RuntimeException e) {
            log.warn("{} - Unsubscribe from {} failed: {}", tenant, topic, e.getMessage());
        }
    }

    @Override
    public void onConnected(BrokerSession source) {
        if (source != session || stopping.get()) {
            return;
        }
        lock.lock();
        try {
            // stop() may have won the race since the check above
            if (source != session || stopping.get() || phase == ConnectionPhase.STOPPED) {
                return;
            }
            phase = ConnectionPhase.CONNECTED;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        backoff.reset();
        reconnectAttempts.set(0);
        attemptsExhausted = false;
        lastHeartbeat = clock.instant();
        lastConnectTime = LocalDateTime.now(clock);
        log.info("{} - Connected to broker", tenant);
        subscribeVisibleDevices();
    }

    @Override
    public void onConnectFailed(BrokerSession source, Throwable cause) {
        if (source != session) {
            return;
        }
        handleConnectionLoss("connect failed: " + (cause == null ? "unknown" : cause.getMessage()));
    }

    @Override
    public void onMessage(BrokerSession source, String topic, byte[] payload) {
        if (source != session || stopping.get()) {
            return;
        }
        lastHeartbeat = clock.instant();
        String text = payload == null ? "" : new String(payload, StandardCharsets.UTF_8);
        try {
            commandHandler.handle(accountKey, topic, text);
        } catch (RuntimeException e) {
            log.error("{} - Failed to handle message on {}: {}", tenant, topic, e.getMessage(), e);
        }
    }

    @Override
    public void onDisconnected(BrokerSession source, Throwable cause, boolean userInitiated) {
        if (userInitiated || source != session) {
            return;
        }
        handleConnectionLoss("connection lost: " + (cause == null ? "unknown" : cause.getMessage()));
    }

    @Override
    public void onHeartbeat(BrokerSession source) {
        if (source == session) {
            lastHeartbeat = clock.instant();
        }
    }

    /**
     * One health evaluation. Runs on the health thread every check period.
     */
    void checkHealth() {
        ConnectionPhase current = phase;
        if (stopping.get() || current == ConnectionPhase.STOPPED || current == ConnectionPhase.IDLE) {
            return;
        }
        if (current == ConnectionPhase.CONNECTED) {
            Duration silent = Duration.between(lastHeartbeat, clock.instant());
            if (silent.compareTo(properties.getHealth().staleAfter()) > 0) {
                log.warn("{} - No heartbeat for {}s", tenant, silent.getSeconds());
                handleConnectionLoss("heartbeat stale");
                return;
            }
            BrokerSession s = session;
            if (s == null || !s.isConnected()) {
                log.warn("{} - Client reports not connected", tenant);
                handleConnectionLoss("client not connected");
            }
            return;
        }
        if (current == ConnectionPhase.DISCONNECTED && !attemptsExhausted) {
            lock.lock();
            try {
                if (phase == ConnectionPhase.DISCONNECTED && !workerAlive()) {
                    log.warn("{} - Disconnected without reconnect worker", tenant);
                    scheduleReconnect();
                }
            } finally {
                lock.unlock();
            }
        }
    }

    public ConnectionStatus getStatus() {
        return ConnectionStatus.builder()
                .accountKey(tenant)
                .phase(phase)
                .connected(isConnected())
                .running(started.get() && !stopping.get())
                .reconnectAttempts(reconnectAttempts.get())
                .currentIntervalMs(backoff.current().toMillis())
                .lastConnectTime(lastConnectTime)
                .lastDisconnectTime(lastDisconnectTime)
                .lastHeartbeatTime(LocalDateTime.ofInstant(lastHeartbeat, clock.getZone()))
                .subscribedTopics(subscribedTopics.size())
                .build();
    }

    public boolean isConnected() {
        return phase == ConnectionPhase.CONNECTED;
    }

    public ConnectionPhase getPhase() {
        return phase;
    }

    public String getAccountKey() {
        return accountKey;
    }

    public Set<String> getSubscribedTopics() {
        return Set.copyOf(subscribedTopics);
    }

    int getReconnectWorkersSpawned() {
        return reconnectWorkersSpawned.get();
    }

    private void subscribeVisibleDevices() {
        List<VtoDevice> devices;
        try {
            devices = deviceRegistry.listVisibleDevices();
        } catch (RuntimeException e) {
            log.error("{} - Cannot load visible devices: {}", tenant, e.getMessage());
            return;
        }
        for (VtoDevice device : devices) {
            subscribe(device.getTopic());
        }
        log.info("{} - {} device topics subscribed", tenant, subscribedTopics.size());
    }

    private void handleConnectionLoss(String reason) {
        if (stopping.get()) {
            return;
        }
        lock.lock();
        try {
            if (phase == ConnectionPhase.STOPPED) {
                return;
            }
            if (workerAlive()) {
                // the running worker owns recovery until it has observed CONNECTED, wake it up
                if (phase == ConnectionPhase.CONNECTED) {
                    log.warn("{} - Connection lost ({}) before the reconnect worker finished, retrying", tenant, reason);
                    phase = ConnectionPhase.RECONNECTING;
                    lastDisconnectTime = LocalDateTime.now(clock);
                    subscribedTopics.clear();
                } else {
                    log.debug("{} - Reconnect attempt failed: {}", tenant, reason);
                }
                attemptFailed = true;
                stateChanged.signalAll();
                return;
            }
            log.warn("{} - Connection lost ({}), scheduling reconnect", tenant, reason);
            phase = ConnectionPhase.DISCONNECTED;
            lastDisconnectTime = LocalDateTime.now(clock);
            subscribedTopics.clear();
            stateChanged.signalAll();
            scheduleReconnect();
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void scheduleReconnect() {
        if (!autoReconnect.get() || stopping.get()) {
            log.info("{} - Auto reconnect disabled, staying disconnected", tenant);
            return;
        }
        if (workerAlive()) {
            return;
        }
        phase = ConnectionPhase.RECONNECTING;
        reconnectWorkersSpawned.incrementAndGet();
        Thread worker = new Thread(this::reconnectLoop, "vto-reconnect-" + tenant);
        worker.setDaemon(true);
        reconnectThread = worker;
        worker.start();
    }

    private void reconnectLoop() {
        BridgeProperties.Reconnect settings = properties.getReconnect();
        BridgeProperties.Mqtt mqtt = properties.getMqtt();
        try {
            while (!stopping.get() && autoReconnect.get() && phase != ConnectionPhase.CONNECTED) {
                int maxAttempts = settings.getMaxAttempts();
                if (maxAttempts > 0 && reconnectAttempts.get() >= maxAttempts) {
                    log.error("{} - Giving up after {} reconnect attempts", tenant, reconnectAttempts.get());
                    lock.lock();
                    try {
                        attemptsExhausted = true;
                        if (phase != ConnectionPhase.STOPPED) {
                            phase = ConnectionPhase.DISCONNECTED;
                        }
                    } finally {
                        lock.unlock();
                    }
                    return;
                }
                Duration delay = backoff.nextDelay();
                log.info("{} - Reconnecting in {} ms", tenant, delay.toMillis());
                if (awaitStop(delay)) {
                    return;
                }
                if (!probe.isReachable(mqtt.getHost(), mqtt.getPort(), settings.getProbeTimeout())) {
                    log.warn("{} - Broker {}:{} unreachable, waiting", tenant, mqtt.getHost(), mqtt.getPort());
                    continue;
                }
                int attempt = reconnectAttempts.incrementAndGet();
                log.info("{} - Reconnect attempt {}", tenant, attempt);
                recreateSession();
                if (awaitConnected(settings.getConnectWait())) {
                    log.info("{} - Reconnected after {} attempt(s)", tenant, attempt);
                    return;
                }
                backoff.grow();
                log.warn("{} - Reconnect attempt {} failed, next interval {} ms",
                        tenant, attempt, backoff.current().toMillis());
            }
        } catch (RuntimeException e) {
            log.error("{} - Reconnect worker failed: {}", tenant, e.getMessage(), e);
            lock.lock();
            try {
                if (phase == ConnectionPhase.RECONNECTING) {
                    phase = ConnectionPhase.DISCONNECTED;
                }
            } finally {
                lock.unlock();
            }
        } finally {
            lock.lock();
            try {
                if (reconnectThread == Thread.currentThread()) {
                    reconnectThread = null;
                    if (phase == ConnectionPhase.RECONNECTING && !stopping.get()) {
                        // a loss was handed to this worker after its last check
                        scheduleReconnect();
                    }
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private void recreateSession() {
        BrokerSession fresh = sessionFactory.create(accountKey, this);
        BrokerSession old;
        lock.lock();
        try {
            if (stopping.get()) {
                closeQuietly(fresh);
                return;
            }
            old = session;
            session = fresh;
            attemptFailed = false;
            subscribedTopics.clear();
        } finally {
            lock.unlock();
        }
        closeQuietly(old);
        connectSession(fresh);
    }

    private void connectSession(BrokerSession target) {
        try {
            target.connect();
        } catch (RuntimeException e) {
            log.error("{} - Cannot start connect: {}", tenant, e.getMessage());
            onConnectFailed(target, e);
        }
    }

    private boolean awaitConnected(Duration timeout) {
        lock.lock();
        try {
            long nanos = timeout.toNanos();
            while (phase != ConnectionPhase.CONNECTED && !stopping.get() && !attemptFailed) {
                if (nanos <= 0) {
                    break;
                }
                nanos = stateChanged.awaitNanos(nanos);
            }
            if (phase != ConnectionPhase.CONNECTED) {
                return false;
            }
            // from here on a new drop needs a fresh worker
            if (reconnectThread == Thread.currentThread()) {
                reconnectThread = null;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps for the given time unless stopped first.
     *
     * @return true when stopped
     */
    private boolean awaitStop(Duration timeout) {
        lock.lock();
        try {
            long nanos = timeout.toNanos();
            while (!stopping.get() && nanos > 0) {
                nanos = stateChanged.awaitNanos(nanos);
            }
            return stopping.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void healthLoop() {
        Duration period = properties.getHealth().getCheckPeriod();
        while (!awaitStop(period)) {
            try {
                checkHealth();
            } catch (RuntimeException e) {
                log.error("{} - Health check failed: {}", tenant, e.getMessage(), e);
            }
        }
    }

    // caller holds lock
    private boolean workerAlive() {
        return reconnectThread != null && reconnectThread.isAlive();
    }

    private void closeQuietly(BrokerSession target) {
        if (target == null) {
            return;
        }
        try {
            target.disconnect();
        } catch (RuntimeException e) {
            log.warn("{} - Error closing session: {}", tenant, e.getMessage());
        }
    }

    private void join(Thread thread, String name) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(properties.getHealth().getJoinTimeout().toMillis());
            if (thread.isAlive()) {
                log.warn("{} - {} thread did not finish within {} ms", tenant, name,
                        properties.getHealth().getJoinTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
