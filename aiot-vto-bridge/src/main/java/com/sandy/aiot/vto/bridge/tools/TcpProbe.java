package com.sandy.aiot.vto.bridge.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Raw TCP reachability check used before spending a reconnect attempt on the broker.
 */
@Slf4j
public final class TcpProbe {

    private TcpProbe() {
    }

    public static boolean isReachable(String host, int port, Duration timeout) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            log.debug("TCP probe failed [host={}; port={}]: {}", host, port, e.getMessage());
            return false;
        }
    }
}
