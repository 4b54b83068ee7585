package com.sandy.aiot.vto.bridge.mqtt;

import com.sandy.aiot.vto.bridge.config.BridgeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class HiveMqBrokerSessionFactory implements BrokerSessionFactory {

    private final BridgeProperties properties;

    @Override
    public BrokerSession create(String accountKey, BrokerSessionListener listener) {
        BridgeProperties.Mqtt mqtt = properties.getMqtt();
        return new HiveMqBrokerSession(accountKey, mqtt.getHost(), mqtt.getPort(),
                properties.getHealth().getHeartbeatInterval(), mqtt.getCloseTimeout(), listener);
    }
}
