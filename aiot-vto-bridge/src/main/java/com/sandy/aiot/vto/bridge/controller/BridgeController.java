package com.sandy.aiot.vto.bridge.controller;

import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import com.sandy.aiot.vto.bridge.mqtt.ConnectionSupervisor;
import com.sandy.aiot.vto.bridge.service.DeviceRegistry;
import com.sandy.aiot.vto.bridge.service.DoorActuationService;
import com.sandy.aiot.vto.bridge.vo.ConnectionStatus;
import com.sandy.aiot.vto.bridge.vo.DoorOpenResult;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operational endpoints of the bridge: connection status, reconciliation and manual unlock.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class BridgeController {

    private final ConnectionSupervisor supervisor;
    private final DeviceRegistry deviceRegistry;
    private final DoorActuationService actuationService;
    private final Clock clock;

    @GetMapping("/mqtt/status")
    public StatusResp status() {
        StatusResp resp = new StatusResp();
        resp.setStarted(supervisor.isStarted());
        resp.setConnected(supervisor.isConnected());
        List<ConnectionStatus> list = new ArrayList<>();
        for (Map.Entry<String, ConnectionStatus> e : supervisor.getStatus().entrySet()) {
            list.add(e.getValue());
        }
        resp.setConnections(list);
        return resp;
    }

    @PostMapping("/mqtt/start")
    public ResponseEntity<ActionResp> start() {
        supervisor.startAll();
        return ResponseEntity.ok(ActionResp.ok("Bridge started"));
    }

    @PostMapping("/mqtt/stop")
    public ResponseEntity<ActionResp> stop() {
        supervisor.stopAll();
        return ResponseEntity.ok(ActionResp.ok("Bridge stopped"));
    }

    @PostMapping("/mqtt/reconcile")
    public ResponseEntity<ActionResp> reconcile() {
        if (!supervisor.isStarted()) {
            return ResponseEntity.ok(ActionResp.fail("Bridge not started"));
        }
        supervisor.reconcile();
        return ResponseEntity.ok(ActionResp.ok("Connections reconciled"));
    }

    @PostMapping("/mqtt/refresh-topics")
    public ResponseEntity<ActionResp> refreshTopics() {
        supervisor.refreshTopics();
        return ResponseEntity.ok(ActionResp.ok("Topics refreshed"));
    }

    @PostMapping("/mqtt/accounts/{accountKey}/start")
    public ResponseEntity<ActionResp> startAccount(@PathVariable String accountKey) {
        boolean started = supervisor.startConnection(accountKey);
        String masked = BemfaAccount.maskKey(accountKey);
        return ResponseEntity.ok(started ? ActionResp.ok("Connection started for " + masked)
                : ActionResp.fail("Connection already running for " + masked));
    }

    @PostMapping("/mqtt/accounts/{accountKey}/stop")
    public ResponseEntity<ActionResp> stopAccount(@PathVariable String accountKey) {
        boolean stopped = supervisor.stopConnection(accountKey);
        String masked = BemfaAccount.maskKey(accountKey);
        return ResponseEntity.ok(stopped ? ActionResp.ok("Connection stopped for " + masked)
                : ActionResp.fail("No connection for " + masked));
    }

    /**
     * Opens a door without going through the broker. No status is pushed to the cloud.
     */
    @PostMapping("/devices/{id}/unlock")
    public ResponseEntity<UnlockResp> unlock(@PathVariable Long id) {
        Optional<VtoDevice> opt = deviceRegistry.findById(id);
        if (opt.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(UnlockResp.fail(null, "Device not found"));
        }
        VtoDevice device = opt.get();
        DoorOpenResult result = actuationService.open(device);
        if (result.isSuccess()) {
            deviceRegistry.recordActuation(device.getId(), LocalDateTime.now(clock));
        }
        UnlockResp resp = new UnlockResp();
        resp.setSuccess(result.isSuccess());
        resp.setStep(result.getStep());
        resp.setMessage(result.isSuccess() ? "Device " + device.getName() + " unlocked" : result.getMessage());
        return ResponseEntity.ok(resp);
    }

    @Data
    public static class StatusResp {
        private boolean started;
        private boolean connected;
        private List<ConnectionStatus> connections;
    }

    @Data
    public static class ActionResp {
        private boolean success;
        private String message;
        public static ActionResp ok(String msg) { ActionResp r = new ActionResp(); r.success = true; r.message = msg; return r; }
        public static ActionResp fail(String msg) { ActionResp r = new ActionResp(); r.success = false; r.message = msg; return r; }
    }

    @Data
    public static class UnlockResp {
        private boolean success;
        private String message;
        private String step;
        static UnlockResp fail(String step, String msg) { UnlockResp r = new UnlockResp(); r.step = step; r.message = msg; return r; }
    }
}
