package com.sandy.aiot.vto.bridge.mqtt;

import com.sandy.aiot.vto.bridge.tools.TcpProbe;

import java.time.Duration;

@FunctionalInterface
public interface ReachabilityProbe {

    boolean isReachable(String host, int port, Duration timeout);

    static ReachabilityProbe tcp() {
        return TcpProbe::isReachable;
    }
}
