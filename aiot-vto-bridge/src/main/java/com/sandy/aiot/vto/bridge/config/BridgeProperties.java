package com.sandy.aiot.vto.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the cloud bridge, bound from the {@code bridge.*} namespace.
 * Defaults match the Bemfa cloud broker and Dahua VTO units.
 */
@Data
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

    private Mqtt mqtt = new Mqtt();
    private Reconnect reconnect = new Reconnect();
    private Health health = new Health();
    private Supervisor supervisor = new Supervisor();
    private Dahua dahua = new Dahua();
    private Bemfa bemfa = new Bemfa();
    private Command command = new Command();

    @Data
    public static class Mqtt {
        /** Start every enabled account connection once the application is ready. */
        private boolean enabled = true;
        private String host = "bemfa.com";
        private int port = 9501;
        private Duration startupDelay = Duration.ofSeconds(3);
        private Duration closeTimeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Reconnect {
        private boolean autoReconnect = true;
        private Duration baseInterval = Duration.ofSeconds(3);
        private Duration maxInterval = Duration.ofSeconds(60);
        private double multiplier = 1.3;
        private double jitterMin = 0.5;
        private double jitterMax = 1.5;
        /** 0 means unbounded. */
        private int maxAttempts = 0;
        private Duration probeTimeout = Duration.ofSeconds(3);
        private Duration connectWait = Duration.ofSeconds(15);
    }

    @Data
    public static class Health {
        private Duration checkPeriod = Duration.ofSeconds(15);
        /** MQTT keep-alive; the session reports a heartbeat once per interval while alive. */
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration heartbeatTimeout = Duration.ofSeconds(15);
        private Duration joinTimeout = Duration.ofSeconds(3);

        public Duration staleAfter() {
            return heartbeatInterval.plus(heartbeatTimeout);
        }
    }

    @Data
    public static class Supervisor {
        private Duration reconcileInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Dahua {
        private int port = 80;
        private int doorIndex = 0;
        private String shortNumber = "04001010001";
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Bemfa {
        private String apiUrl = "https://apis.bemfa.com";
        private Duration timeout = Duration.ofSeconds(30);
        private String closedStatus = "off";
    }

    @Data
    public static class Command {
        private List<String> openTokens = new ArrayList<>(List.of("open", "on"));
        private List<String> localizedTokens = new ArrayList<>(List.of("打开"));
    }
}
