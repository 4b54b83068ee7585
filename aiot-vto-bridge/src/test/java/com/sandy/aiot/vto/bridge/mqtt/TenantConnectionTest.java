package com.sandy.aiot.vto.bridge.mqtt;

import com.sandy.aiot.vto.bridge.config.BridgeProperties;
import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import com.sandy.aiot.vto.bridge.service.DeviceRegistry;
import com.sandy.aiot.vto.bridge.service.impl.DoorCommandHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TenantConnectionTest {

    private static final String KEY = "4d9ec352e0376f2110a0c601a2857225";

    BridgeProperties properties;
    FakeBrokerSessionFactory factory;
    DeviceRegistry deviceRegistry;
    DoorCommandHandler commandHandler;
    MutableClock clock;
    TenantConnection connection;

    @BeforeEach
    void setup() {
        properties = new BridgeProperties();
        // slow background threads unless a test speeds them up
        properties.getReconnect().setBaseInterval(Duration.ofMinutes(10));
        properties.getReconnect().setMaxInterval(Duration.ofMinutes(20));
        properties.getHealth().setCheckPeriod(Duration.ofMinutes(10));
        properties.getHealth().setJoinTimeout(Duration.ofSeconds(1));
        factory = new FakeBrokerSessionFactory();
        deviceRegistry = mock(DeviceRegistry.class);
        commandHandler = mock(DoorCommandHandler.class);
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        when(deviceRegistry.listVisibleDevices()).thenReturn(List.of(device("vto10001006"), device("vto10002006")));
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.stop();
        }
    }

    @Test
    void connectSubscribesEveryVisibleTopicOnce() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> false);
        connection.start();
        assertEquals(ConnectionPhase.CONNECTING, connection.getPhase());

        FakeBrokerSession session = factory.last();
        assertTrue(session.connectCalled);
        session.acceptConnect();

        assertEquals(ConnectionPhase.CONNECTED, connection.getPhase());
        assertEquals(List.of("vto10001006", "vto10002006"), session.subscribed);

        connection.subscribe("vto10001006");
        assertEquals(2, session.subscribed.size(), "Second subscribe of the same topic is a no-op");
        assertEquals(2, connection.getStatus().getSubscribedTopics());
    }

    @Test
    void startTwiceOpensOneSession() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> false);
        connection.start();
        connection.start();
        assertEquals(1, factory.created.size());
    }

    @Test
    void subscribeBeforeConnectIsSkipped() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> false);
        connection.start();
        connection.subscribe("vto10003006");
        assertTrue(factory.last().subscribed.isEmpty());
        assertTrue(connection.getSubscribedTopics().isEmpty());
    }

    @Test
    void rejectedSubscriptionIsForgotten() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> false);
        connection.start();
        FakeBrokerSession session = factory.last();
        session.acceptConnect();

        session.failSubscribe = true;
        connection.subscribe("vto10003006");
        assertFalse(connection.getSubscribedTopics().contains("vto10003006"));

        session.failSubscribe = false;
        connection.subscribe("vto10003006");
        assertTrue(connection.getSubscribedTopics().contains("vto10003006"));
    }

    @Test
    void unsubscribeOnlyForSubscribedTopics() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> false);
        connection.start();
        FakeBrokerSession session = factory.last();
        session.acceptConnect();

        connection.unsubscribe("vto99999006");
        connection.unsubscribe("vto10001006");
        connection.unsubscribe("vto10001006");
        assertEquals(List.of("vto10001006"), session.unsubscribed);
    }

    @Test
    void messagesReachTheHandlerAndRefreshHeartbeat() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> false);
        connection.start();
        FakeBrokerSession session = factory.last();
        session.acceptConnect();

        clock.advance(Duration.ofSeconds(40));
        session.deliver("vto10001006", "打开");
        verify(commandHandler).handle(KEY, "vto10001006", "打开");

        clock.advance(Duration.ofSeconds(40));
        connection.checkHealth();
        assertEquals(ConnectionPhase.CONNECTED, connection.getPhase(), "Inbound traffic counts as heartbeat");
    }

    @Test
    void handlerFailureDoesNotBreakTheConnection() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> false);
        connection.start();
        FakeBrokerSession session = factory.last();
        session.acceptConnect();
        doThrow(new IllegalStateException("boom")).when(commandHandler).handle(anyString(), anyString(), anyString());

        session.deliver("vto10001006", "open");
        assertEquals(ConnectionPhase.CONNECTED, connection.getPhase());
    }

    @Test
    void staleHeartbeatSchedulesExactlyOneReconnectWorker() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> false);
        connection.start();
        factory.last().acceptConnect();

        clock.advance(Duration.ofSeconds(46));
        connection.checkHealth();
        assertEquals(ConnectionPhase.RECONNECTING, connection.getPhase());
        assertTrue(connection.getSubscribedTopics().isEmpty(), "Clean session, subscriptions are gone");

        connection.checkHealth();
        factory.last().drop();
        assertEquals(ConnectionPhase.RECONNECTING, connection.getPhase());
        assertEquals(1, connection.getReconnectWorkersSpawned());
    }

    @Test
    void clientReportingNotConnectedTriggersReconnect() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> false);
        connection.start();
        FakeBrokerSession session = factory.last();
        session.acceptConnect();

        session.connected = false;
        connection.checkHealth();
        assertEquals(ConnectionPhase.RECONNECTING, connection.getPhase());
        assertNotNull(connection.getStatus().getLastDisconnectTime());
    }

    @Test
    void backoffGrowsOnFailuresAndResetsOnConnect() throws Exception {
        BridgeProperties.Reconnect reconnect = properties.getReconnect();
        reconnect.setBaseInterval(Duration.ofMillis(20));
        reconnect.setMaxInterval(Duration.ofMillis(60));
        reconnect.setConnectWait(Duration.ofMillis(30));
        BackoffPolicy backoff = new BackoffPolicy(reconnect.getBaseInterval(), reconnect.getMaxInterval(),
                1.3, 1.0, 1.0, new Random(1));
        connection = newConnection(backoff, (h, p, t) -> true);
        connection.start();
        factory.last().acceptConnect();

        factory.last().drop();
        waitUntil(() -> backoff.current().toMillis() == 60, Duration.ofSeconds(5));
        assertTrue(connection.getStatus().getReconnectAttempts() >= 3);

        factory.acceptOnConnect = true;
        waitUntil(() -> connection.getPhase() == ConnectionPhase.CONNECTED
                && factory.last().subscribed.size() == 2, Duration.ofSeconds(5));
        assertEquals(Duration.ofMillis(20), backoff.current());
        assertEquals(0, connection.getStatus().getReconnectAttempts());
        assertEquals(List.of("vto10001006", "vto10002006"), factory.last().subscribed);
        assertTrue(factory.created.get(1).disconnected, "Replaced sessions are closed");
    }

    @Test
    void unreachableBrokerDoesNotGrowBackoff() throws Exception {
        BridgeProperties.Reconnect reconnect = properties.getReconnect();
        reconnect.setBaseInterval(Duration.ofMillis(10));
        BackoffPolicy backoff = new BackoffPolicy(reconnect.getBaseInterval(), Duration.ofSeconds(1),
                1.3, 1.0, 1.0, new Random(1));
        AtomicInteger probes = new AtomicInteger();
        connection = newConnection(backoff, (h, p, t) -> {
            probes.incrementAndGet();
            return false;
        });
        connection.start();
        factory.last().acceptConnect();
        factory.last().drop();

        waitUntil(() -> probes.get() >= 3, Duration.ofSeconds(5));
        assertEquals(Duration.ofMillis(10), backoff.current());
        assertEquals(1, factory.created.size(), "No session is created while the broker is unreachable");
    }

    @Test
    void workerGivesUpAfterMaxAttempts() throws Exception {
        BridgeProperties.Reconnect reconnect = properties.getReconnect();
        reconnect.setBaseInterval(Duration.ofMillis(10));
        reconnect.setMaxAttempts(2);
        reconnect.setConnectWait(Duration.ofMillis(20));
        BackoffPolicy backoff = new BackoffPolicy(reconnect.getBaseInterval(), Duration.ofMillis(50),
                1.3, 1.0, 1.0, new Random(1));
        connection = newConnection(backoff, (h, p, t) -> true);
        connection.start();
        factory.last().acceptConnect();
        factory.last().drop();

        waitUntil(() -> connection.getPhase() == ConnectionPhase.DISCONNECTED
                && connection.getStatus().getReconnectAttempts() == 2, Duration.ofSeconds(5));
        Thread.sleep(100);
        connection.checkHealth();
        assertEquals(1, connection.getReconnectWorkersSpawned());
        assertEquals(ConnectionPhase.DISCONNECTED, connection.getPhase());
    }

    @Test
    void stopCancelsReconnectAndIgnoresLateEvents() {
        connection = newConnection(BackoffPolicy.from(properties.getReconnect()), (h, p, t) -> true);
        connection.start();
        FakeBrokerSession session = factory.last();
        session.acceptConnect();
        session.drop();
        assertEquals(ConnectionPhase.RECONNECTING, connection.getPhase());

        long begin = System.nanoTime();
        connection.stop();
        assertTrue(Duration.ofNanos(System.nanoTime() - begin).compareTo(Duration.ofSeconds(2)) < 0);
        assertEquals(ConnectionPhase.STOPPED, connection.getPhase());
        assertTrue(session.disconnected);
        assertFalse(connection.getStatus().isRunning());

        session.deliver("vto10001006", "open");
        session.acceptConnect();
        assertEquals(ConnectionPhase.STOPPED, connection.getPhase());
        verify(commandHandler, never()).handle(any(), any(), any());
    }

    @Test
    void eventsFromReplacedSessionAreIgnored() throws Exception {
        BridgeProperties.Reconnect reconnect = properties.getReconnect();
        reconnect.setBaseInterval(Duration.ofMillis(10));
        BackoffPolicy backoff = new BackoffPolicy(reconnect.getBaseInterval(), Duration.ofMillis(50),
                1.3, 1.0, 1.0, new Random(1));
        connection = newConnection(backoff, (h, p, t) -> true);
        connection.start();
        FakeBrokerSession first = factory.last();
        first.acceptConnect();
        factory.acceptOnConnect = true;
        first.drop();
        waitUntil(() -> connection.getPhase() == ConnectionPhase.CONNECTED && factory.created.size() == 2,
                Duration.ofSeconds(5));

        first.drop();
        first.deliver("vto10001006", "open");
        assertEquals(ConnectionPhase.CONNECTED, connection.getPhase());
        verify(commandHandler, never()).handle(any(), any(), any());
    }

    @Test
    void dropRightAfterReconnectStartsAnotherAttemptWithoutWaiting() throws Exception {
        BridgeProperties.Reconnect reconnect = properties.getReconnect();
        reconnect.setBaseInterval(Duration.ofMillis(10));
        reconnect.setConnectWait(Duration.ofSeconds(30));
        BackoffPolicy backoff = new BackoffPolicy(reconnect.getBaseInterval(), Duration.ofMillis(50),
                1.3, 1.0, 1.0, new Random(1));
        connection = newConnection(backoff, (h, p, t) -> true);
        connection.start();
        FakeBrokerSession first = factory.last();
        first.acceptConnect();
        first.drop();

        waitUntil(() -> factory.created.size() == 2 && factory.last().connectCalled, Duration.ofSeconds(5));
        FakeBrokerSession second = factory.last();
        second.acceptConnect();
        second.drop();

        // well below the 30s connect wait and the health check period
        waitUntil(() -> factory.created.size() == 3 && factory.last().connectCalled, Duration.ofSeconds(5));
        factory.last().acceptConnect();
        assertEquals(ConnectionPhase.CONNECTED, connection.getPhase());
        assertNotNull(connection.getStatus().getLastDisconnectTime());
    }

    @Test
    void connectAckRacingStopLeavesConnectionStopped() throws Exception {
        for (int i = 0; i < 200; i++) {
            FakeBrokerSessionFactory sessions = new FakeBrokerSessionFactory();
            TenantConnection racing = new TenantConnection(KEY, properties, sessions, deviceRegistry, commandHandler,
                    (h, p, t) -> false, BackoffPolicy.from(properties.getReconnect()), clock);
            racing.start();
            FakeBrokerSession session = sessions.last();
            CountDownLatch go = new CountDownLatch(1);
            Thread connector = new Thread(() -> {
                try {
                    go.await();
                    session.acceptConnect();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            connector.start();
            go.countDown();
            racing.stop();
            connector.join(1000);

            assertEquals(ConnectionPhase.STOPPED, racing.getPhase(), "Iteration " + i);
            assertFalse(racing.isConnected());
        }
    }

    private TenantConnection newConnection(BackoffPolicy backoff, ReachabilityProbe probe) {
        return new TenantConnection(KEY, properties, factory, deviceRegistry, commandHandler, probe, backoff, clock);
    }

    private static VtoDevice device(String topic) {
        VtoDevice d = new VtoDevice();
        d.setName(topic);
        d.setTopic(topic);
        d.setVisible(true);
        return d;
    }

    private static void waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + timeout);
            }
            Thread.sleep(5);
        }
    }
}
