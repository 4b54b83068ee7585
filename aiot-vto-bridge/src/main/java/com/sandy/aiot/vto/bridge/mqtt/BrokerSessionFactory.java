package com.sandy.aiot.vto.bridge.mqtt;

public interface BrokerSessionFactory {
    BrokerSession create(String accountKey, BrokerSessionListener listener);
}
