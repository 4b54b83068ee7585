package com.sandy.aiot.vto.bridge.mqtt;

import com.hivemq.client.mqtt.MqttGlobalPublishFilter;
import com.hivemq.client.mqtt.datatypes.MqttQos;
import com.hivemq.client.mqtt.lifecycle.MqttClientDisconnectedContext;
import com.hivemq.client.mqtt.lifecycle.MqttDisconnectSource;
import com.hivemq.client.mqtt.mqtt3.Mqtt3AsyncClient;
import com.hivemq.client.mqtt.mqtt3.Mqtt3Client;
import com.hivemq.client.mqtt.mqtt3.message.publish.Mqtt3Publish;
import com.hivemq.client.mqtt.mqtt3.message.subscribe.suback.Mqtt3SubAckReturnCode;
import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link BrokerSession} on the HiveMQ MQTT 3.1.1 async client: clean session, QoS 0, client
 * identifier = account key. Inbound publishes and connection callbacks are delivered on one
 * dedicated thread; the client library drives the network I/O and the PINGREQ keep-alive.
 */
@Slf4j
public class HiveMqBrokerSession implements BrokerSession {

    private final String tenant;
    private final Duration keepAlive;
    private final Duration closeTimeout;
    private final BrokerSessionListener listener;
    private final Mqtt3AsyncClient client;
    private final ExecutorService inbound;
    private final ScheduledExecutorService ticker;
    private final AtomicBoolean connectRequested = new AtomicBoolean(false);
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HiveMqBrokerSession(String accountKey, String host, int port, Duration keepAlive,
                               Duration closeTimeout, BrokerSessionListener listener) {
        this.tenant = BemfaAccount.maskKey(accountKey);
        this.keepAlive = keepAlive;
        this.closeTimeout = closeTimeout;
        this.listener = listener;
        this.inbound = Executors.newSingleThreadExecutor(daemonThreads("vto-mqtt-in-"));
        this.ticker = Executors.newSingleThreadScheduledExecutor(daemonThreads("vto-mqtt-tick-"));
        this.client = Mqtt3Client.builder()
                .identifier(accountKey)
                .serverHost(host)
                .serverPort(port)
                .addDisconnectedListener(this::onClientDisconnected)
                .buildAsync();
    }

    @Override
    public void connect() {
        if (closed.get()) {
            throw new IllegalStateException("Session already closed");
        }
        if (!connectRequested.compareAndSet(false, true)) {
            log.debug("{} - Connect already requested on this session", tenant);
            return;
        }
        client.publishes(MqttGlobalPublishFilter.SUBSCRIBED, this::onPublish, inbound);
        client.connectWith()
                .cleanSession(true)
                .keepAlive((int) keepAlive.getSeconds())
                .send()
                .whenComplete((ack, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = unwrap(throwable);
                        log.warn("{} - MQTT connect failed: {}: {}", tenant,
                                cause.getClass().getSimpleName(), cause.getMessage());
                        dispatch(() -> listener.onConnectFailed(this, cause));
                        return;
                    }
                    if (closed.get()) {
                        // closed while the CONNACK was in flight; do not leave a client holding the identifier
                        client.disconnect();
                        return;
                    }
                    connected.set(true);
                    log.info("{} - MQTT connected, returnCode={}", tenant, ack.getReturnCode());
                    dispatch(() -> {
                        listener.onHeartbeat(this);
                        listener.onConnected(this);
                    });
                });
        long tickMs = Math.max(1000L, keepAlive.toMillis());
        ticker.scheduleAtFixedRate(this::tick, tickMs, tickMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void disconnect() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ticker.shutdownNow();
        try {
            if (client.getState().isConnected()) {
                client.disconnect().get(closeTimeout.toMillis(), TimeUnit.MILLISECONDS);
                log.info("{} - MQTT disconnected", tenant);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("{} - Error disconnecting MQTT client: {}", tenant, e.getMessage());
        } finally {
            connected.set(false);
            inbound.shutdown();
        }
    }

    @Override
    public CompletableFuture<Void> subscribe(String topic) {
        return client.subscribeWith()
                .topicFilter(topic)
                .qos(MqttQos.AT_MOST_ONCE)
                .send()
                .thenAccept(subAck -> {
                    if (subAck.getReturnCodes().contains(Mqtt3SubAckReturnCode.FAILURE)) {
                        throw new CompletionException(
                                new IllegalStateException("Broker rejected subscription to " + topic));
                    }
                    listener.onHeartbeat(this);
                });
    }

    @Override
    public CompletableFuture<Void> unsubscribe(String topic) {
        return client.unsubscribeWith()
                .topicFilter(topic)
                .send()
                .thenRun(() -> listener.onHeartbeat(this));
    }

    @Override
    public boolean isConnected() {
        return connected.get() && client.getState().isConnected();
    }

    private void onPublish(Mqtt3Publish publish) {
        try {
            listener.onMessage(this, publish.getTopic().toString(), publish.getPayloadAsBytes());
        } catch (RuntimeException e) {
            log.error("{} - Error handling message on {}: {}", tenant, publish.getTopic(), e.getMessage(), e);
        }
    }

    private void onClientDisconnected(MqttClientDisconnectedContext context) {
        boolean wasConnected = connected.getAndSet(false);
        if (!wasConnected) {
            // failed connects are reported through the connect future
            return;
        }
        boolean userInitiated = closed.get() || context.getSource() == MqttDisconnectSource.USER;
        Throwable cause = context.getCause();
        if (userInitiated) {
            log.debug("{} - MQTT session closed by client", tenant);
            return;
        }
        log.warn("{} - MQTT connection lost [source={}]: {}", tenant, context.getSource(), cause.getMessage());
        dispatch(() -> listener.onDisconnected(this, cause, false));
    }

    private void tick() {
        if (connected.get() && client.getState().isConnected()) {
            listener.onHeartbeat(this);
        }
    }

    private void dispatch(Runnable callback) {
        if (closed.get()) {
            return;
        }
        try {
            inbound.execute(() -> {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    log.error("{} - Session listener failed: {}", tenant, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("{} - Session already shut down, callback dropped", tenant);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        return throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause() : throwable;
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
