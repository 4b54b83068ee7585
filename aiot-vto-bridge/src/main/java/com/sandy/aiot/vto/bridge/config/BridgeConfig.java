package com.sandy.aiot.vto.bridge.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class BridgeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Client for the door stations; every RPC step is bounded by the dahua timeout.
     */
    @Bean
    public RestTemplate dahuaRestTemplate(RestTemplateBuilder builder, BridgeProperties properties) {
        return builder
                .setConnectTimeout(properties.getDahua().getTimeout())
                .setReadTimeout(properties.getDahua().getTimeout())
                .build();
    }

    @Bean
    public RestTemplate bemfaRestTemplate(RestTemplateBuilder builder, BridgeProperties properties) {
        return builder
                .rootUri(properties.getBemfa().getApiUrl())
                .setConnectTimeout(properties.getBemfa().getTimeout())
                .setReadTimeout(properties.getBemfa().getTimeout())
                .build();
    }
}
