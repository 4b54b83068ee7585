package com.sandy.aiot.vto.bridge.mqtt;

import com.sandy.aiot.vto.bridge.config.BridgeProperties;
import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import com.sandy.aiot.vto.bridge.service.AccountRegistry;
import com.sandy.aiot.vto.bridge.service.DeviceRegistry;
import com.sandy.aiot.vto.bridge.service.RemoteTopicSync;
import com.sandy.aiot.vto.bridge.service.impl.DoorCommandHandler;
import com.sandy.aiot.vto.bridge.vo.TopicSyncSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConnectionSupervisorTest {

    BridgeProperties properties;
    AccountRegistry accountRegistry;
    DeviceRegistry deviceRegistry;
    RemoteTopicSync remoteTopicSync;
    FakeBrokerSessionFactory factory;
    ConnectionSupervisor supervisor;

    @BeforeEach
    void setup() {
        properties = new BridgeProperties();
        properties.getReconnect().setBaseInterval(Duration.ofMinutes(10));
        properties.getReconnect().setMaxInterval(Duration.ofMinutes(10));
        properties.getHealth().setCheckPeriod(Duration.ofMinutes(10));
        properties.getHealth().setJoinTimeout(Duration.ofSeconds(1));
        accountRegistry = mock(AccountRegistry.class);
        deviceRegistry = mock(DeviceRegistry.class);
        remoteTopicSync = mock(RemoteTopicSync.class);
        when(remoteTopicSync.reconcileRemoteTopics(anyString())).thenReturn(TopicSyncSummary.empty());
        factory = new FakeBrokerSessionFactory(true);
        supervisor = new ConnectionSupervisor(properties, accountRegistry, deviceRegistry, remoteTopicSync,
                factory, mock(DoorCommandHandler.class), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        supervisor.stopAll();
    }

    @Test
    void startAllOpensOneConnectionPerEnabledAccount() {
        when(accountRegistry.listEnabledAccounts()).thenReturn(accounts("A", "B"));
        supervisor.startAll();

        assertEquals(List.of("A", "B"), List.copyOf(supervisor.getStatus().keySet()));
        assertTrue(supervisor.isConnected());
        assertEquals(ConnectionPhase.CONNECTED, supervisor.getStatus().get("A").getPhase());
        verify(remoteTopicSync).reconcileRemoteTopics("A");
        verify(remoteTopicSync).reconcileRemoteTopics("B");
    }

    @Test
    void remoteSyncRunsOnlyOnFirstStart() {
        when(accountRegistry.listEnabledAccounts()).thenReturn(accounts("A"));
        supervisor.startAll();
        supervisor.startAll();

        verify(remoteTopicSync, times(1)).reconcileRemoteTopics("A");
        assertEquals(2, factory.sessionsOf("A").size(), "Second start restarts the connection");
        assertTrue(factory.sessionsOf("A").get(0).disconnected);
    }

    @Test
    void reconcileStopsRemovedStartsAddedAndLeavesTheRest() {
        when(accountRegistry.listEnabledAccounts()).thenReturn(accounts("A", "B"));
        supervisor.startAll();
        FakeBrokerSession sessionB = factory.sessionsOf("B").get(0);

        when(accountRegistry.listEnabledAccounts()).thenReturn(accounts("B", "C"));
        supervisor.reconcile();

        assertEquals(List.of("B", "C"), List.copyOf(supervisor.getStatus().keySet()));
        assertTrue(factory.sessionsOf("A").get(0).disconnected, "A stopped");
        assertEquals(List.of(sessionB), factory.sessionsOf("B"), "B untouched");
        assertFalse(sessionB.disconnected);
        assertEquals(1, factory.sessionsOf("C").size(), "C started");
    }

    @Test
    void reconcileDoesNothingUntilStarted() {
        when(accountRegistry.listEnabledAccounts()).thenReturn(accounts("A"));
        supervisor.reconcile();
        assertTrue(factory.created.isEmpty());

        supervisor.startAll();
        supervisor.stopAll();
        supervisor.reconcile();
        assertEquals(1, factory.created.size());
        assertTrue(supervisor.getStatus().isEmpty());
    }

    @Test
    void startAndStopSingleConnection() {
        assertTrue(supervisor.startConnection("A"));
        assertFalse(supervisor.startConnection("A"), "Already running");
        assertFalse(supervisor.startConnection(" "));

        assertTrue(supervisor.stopConnection("A"));
        assertFalse(supervisor.stopConnection("A"));
        assertTrue(factory.sessionsOf("A").get(0).disconnected);
    }

    @Test
    void refreshTopicsSubscribesVisibleAndDropsHidden() {
        when(accountRegistry.listEnabledAccounts()).thenReturn(accounts("A", "B"));
        when(deviceRegistry.listVisibleDevices()).thenReturn(devices("vto1006", "vto2006"));
        supervisor.startAll();

        when(deviceRegistry.listVisibleDevices()).thenReturn(devices("vto2006", "vto3006"));
        supervisor.refreshTopics();

        for (String key : List.of("A", "B")) {
            FakeBrokerSession session = factory.sessionsOf(key).get(0);
            assertEquals(List.of("vto1006", "vto2006", "vto3006"), session.subscribed);
            assertEquals(List.of("vto1006"), session.unsubscribed);
        }
        verify(remoteTopicSync, times(2)).reconcileRemoteTopics("A");
    }

    @Test
    void subscribeFanOutReachesEveryConnection() {
        when(accountRegistry.listEnabledAccounts()).thenReturn(accounts("A", "B"));
        supervisor.startAll();
        factory.sessionsOf("A").get(0).failSubscribe = true;

        supervisor.subscribeTopic("vto9006");

        assertTrue(factory.sessionsOf("B").get(0).subscribed.contains("vto9006"));
        assertFalse(supervisor.getStatus().isEmpty());

        supervisor.unsubscribeTopic("vto9006");
        assertEquals(List.of("vto9006"), factory.sessionsOf("B").get(0).unsubscribed);
    }

    @Test
    void registryFailureKeepsRunningConnections() {
        when(accountRegistry.listEnabledAccounts()).thenReturn(accounts("A"));
        supervisor.startAll();

        when(accountRegistry.listEnabledAccounts()).thenThrow(new IllegalStateException("db down"));
        supervisor.reconcile();
        assertEquals(List.of("A"), List.copyOf(supervisor.getStatus().keySet()));
    }

    private static List<BemfaAccount> accounts(String... keys) {
        return Arrays.stream(keys)
                .map(k -> BemfaAccount.builder().name("account-" + k).accountKey(k).build())
                .collect(Collectors.toList());
    }

    private static List<VtoDevice> devices(String... topics) {
        return Arrays.stream(topics)
                .map(t -> VtoDevice.builder().name(t).address("10.0.0.1").topic(t).visible(true).build())
                .collect(Collectors.toList());
    }
}
