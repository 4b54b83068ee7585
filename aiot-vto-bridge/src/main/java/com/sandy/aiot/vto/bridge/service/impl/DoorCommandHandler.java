package com.sandy.aiot.vto.bridge.service.impl;

import com.sandy.aiot.vto.bridge.config.BridgeProperties;
import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import com.sandy.aiot.vto.bridge.service.AccountRegistry;
import com.sandy.aiot.vto.bridge.service.DeviceRegistry;
import com.sandy.aiot.vto.bridge.service.DoorActuationService;
import com.sandy.aiot.vto.bridge.service.PushbackSender;
import com.sandy.aiot.vto.bridge.tools.DeviceTopics;
import com.sandy.aiot.vto.bridge.vo.CommandOutcome;
import com.sandy.aiot.vto.bridge.vo.DoorOpenResult;
import com.sandy.aiot.vto.bridge.vo.PushbackResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns a message received on a device topic into a door unlock, then reports the
 * new state to every enabled account. Runs on the inbound thread of the receiving
 * connection, one message at a time.
 */
@Service
@Slf4j
public class DoorCommandHandler {

    private final DeviceRegistry deviceRegistry;
    private final AccountRegistry accountRegistry;
    private final DoorActuationService actuationService;
    private final PushbackSender pushbackSender;
    private final BridgeProperties properties;
    private final Clock clock;

    public DoorCommandHandler(DeviceRegistry deviceRegistry,
                              AccountRegistry accountRegistry,
                              DoorActuationService actuationService,
                              PushbackSender pushbackSender,
                              BridgeProperties properties,
                              Clock clock) {
        this.deviceRegistry = deviceRegistry;
        this.accountRegistry = accountRegistry;
        this.actuationService = actuationService;
        this.pushbackSender = pushbackSender;
        this.properties = properties;
        this.clock = clock;
    }

    public CommandOutcome handle(String accountKey, String topic, String payload) {
        String tenant = BemfaAccount.maskKey(accountKey);
        log.info("{} - Message received topic={} payload={}", tenant, topic, payload);

        if (!DeviceTopics.isDeviceTopic(topic)) {
            log.warn("{} - Topic {} is not a door station topic, message dropped", tenant, topic);
            return CommandOutcome.of(CommandOutcome.Status.UNKNOWN_TOPIC, topic);
        }
        Optional<VtoDevice> found;
        try {
            found = deviceRegistry.findDeviceByTopic(topic);
        } catch (RuntimeException e) {
            log.error("{} - Device lookup failed topic={}: {}", tenant, topic, e.getMessage());
            return CommandOutcome.of(CommandOutcome.Status.UNKNOWN_TOPIC, topic);
        }
        if (found.isEmpty()) {
            log.warn("{} - No device for topic {}, message dropped", tenant, topic);
            return CommandOutcome.of(CommandOutcome.Status.UNKNOWN_TOPIC, topic);
        }
        VtoDevice device = found.get();

        if (!isOpenCommand(payload)) {
            log.debug("{} - Ignoring non-open payload for device {}: {}", tenant, device.getName(), payload);
            return CommandOutcome.of(CommandOutcome.Status.NOT_AN_OPEN_COMMAND, topic);
        }

        log.info("{} - Open command for device {} ({})", tenant, device.getName(), device.getAddress());
        DoorOpenResult result;
        try {
            result = actuationService.open(device);
        } catch (RuntimeException e) {
            log.error("{} - Unlock of device {} ({}) failed: {}", tenant, device.getName(), device.getAddress(), e.getMessage(), e);
            result = DoorOpenResult.failure("unknown", e.getMessage());
        }
        CommandOutcome outcome = CommandOutcome.builder()
                .status(result.isSuccess() ? CommandOutcome.Status.UNLOCKED : CommandOutcome.Status.ACTUATION_FAILED)
                .topic(topic)
                .doorOpenResult(result)
                .build();
        if (!result.isSuccess()) {
            log.error("{} - Device {} ({}) did not open at step {}: {}", tenant, device.getName(),
                    device.getAddress(), result.getStep(), result.getMessage());
            return outcome;
        }

        try {
            deviceRegistry.recordActuation(device.getId(), LocalDateTime.now(clock));
        } catch (RuntimeException e) {
            log.error("{} - Could not record unlock time of device {}: {}", tenant, device.getName(), e.getMessage());
        }
        sendClosedStatus(device, outcome);
        return outcome;
    }

    /**
     * True for payloads equal to an open token (any case) or containing a localized one.
     */
    public boolean isOpenCommand(String payload) {
        if (payload == null) return false;
        String normalized = payload.trim().toLowerCase(Locale.ROOT);
        for (String token : properties.getCommand().getOpenTokens()) {
            if (normalized.equals(token.toLowerCase(Locale.ROOT))) return true;
        }
        for (String token : properties.getCommand().getLocalizedTokens()) {
            if (!token.isEmpty() && payload.contains(token)) return true;
        }
        return false;
    }

    private void sendClosedStatus(VtoDevice device, CommandOutcome outcome) {
        List<BemfaAccount> accounts;
        try {
            accounts = accountRegistry.listEnabledAccounts();
        } catch (RuntimeException e) {
            log.error("Cannot load enabled accounts for status push of {}: {}", device.getTopic(), e.getMessage());
            return;
        }
        String status = properties.getBemfa().getClosedStatus();
        String message = String.format("Device %s unlocked, current state: closed", device.getName());
        for (BemfaAccount account : accounts) {
            PushbackResult result;
            try {
                result = pushbackSender.sendStatus(account.getAccountKey(), device.getTopic(), status, message);
            } catch (RuntimeException e) {
                result = PushbackResult.failed(e.getMessage());
            }
            outcome.getPushback().put(account.maskedKey(), result);
            if (result.isSuccess()) {
                log.info("Status push to account {} succeeded topic={}", account.getName(), device.getTopic());
            } else {
                log.error("Status push to account {} failed topic={} code={} message={}",
                        account.getName(), device.getTopic(), result.getCode(), result.getMessage());
            }
        }
    }
}
