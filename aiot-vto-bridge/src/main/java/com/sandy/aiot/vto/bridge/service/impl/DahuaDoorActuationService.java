package com.sandy.aiot.vto.bridge.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vto.bridge.config.BridgeProperties;
import com.sandy.aiot.vto.bridge.entity.VtoDevice;
import com.sandy.aiot.vto.bridge.service.DoorActuationService;
import com.sandy.aiot.vto.bridge.vo.DoorOpenResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

/**
 * Opens doors through a fresh {@link DahuaRpcClient} per call, so no session outlives one attempt.
 */
@Service
@Slf4j
public class DahuaDoorActuationService implements DoorActuationService {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final BridgeProperties.Dahua settings;

    public DahuaDoorActuationService(@Qualifier("dahuaRestTemplate") RestTemplate restTemplate,
                                     ObjectMapper objectMapper,
                                     BridgeProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = properties.getDahua();
    }

    @Override
    public DoorOpenResult open(VtoDevice device) {
        if (device == null || device.getAddress() == null || device.getAddress().isBlank()) {
            return DoorOpenResult.failure(DahuaRpcClient.STEP_LOGIN, "Device has no address");
        }
        DahuaRpcClient client = new DahuaRpcClient(device.getAddress(), settings.getPort(),
                device.getUsername(), device.getPassword(), restTemplate, objectMapper);
        long start = System.currentTimeMillis();
        DoorOpenResult result = client.executeOpenFlow(settings.getDoorIndex(), settings.getShortNumber());
        long cost = System.currentTimeMillis() - start;
        if (result.isSuccess()) {
            log.info("Door unlocked: device={} address={} durationMs={}", device.getName(), device.getAddress(), cost);
        } else {
            log.warn("Door unlock failed: device={} address={} step={} message={} durationMs={}",
                    device.getName(), device.getAddress(), result.getStep(), result.getMessage(), cost);
        }
        return result;
    }
}
