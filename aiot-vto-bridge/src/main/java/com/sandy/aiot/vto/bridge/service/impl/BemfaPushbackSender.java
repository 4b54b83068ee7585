package com.sandy.aiot.vto.bridge.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import com.sandy.aiot.vto.bridge.service.PushbackSender;
import com.sandy.aiot.vto.bridge.vo.PushbackResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends device status messages through the Bemfa push API ({@code /va/postJsonMsg}).
 */
@Service
@Slf4j
public class BemfaPushbackSender implements PushbackSender {

    static final String POST_JSON_MSG = "/va/postJsonMsg";
    /** Bemfa topic type 1 = MQTT device. */
    private static final int MQTT_TOPIC_TYPE = 1;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public BemfaPushbackSender(@Qualifier("bemfaRestTemplate") RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public PushbackResult sendStatus(String accountKey, String topic, String status, String humanMessage) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("uid", accountKey);
        body.put("topic", topic);
        body.put("type", MQTT_TOPIC_TYPE);
        body.put("msg", status);
        if (humanMessage != null && !humanMessage.isBlank()) {
            body.put("wemsg", humanMessage);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType(MediaType.APPLICATION_JSON, StandardCharsets.UTF_8));
        try {
            String json = objectMapper.writeValueAsString(body);
            ResponseEntity<String> resp = restTemplate.postForEntity(POST_JSON_MSG, new HttpEntity<>(json, headers), String.class);
            if (!resp.getStatusCode().is2xxSuccessful() || resp.getBody() == null) {
                log.warn("Bemfa push returned non-success status: account={} topic={} status={}",
                        BemfaAccount.maskKey(accountKey), topic, resp.getStatusCode());
                return PushbackResult.failed("HTTP " + resp.getStatusCode().value());
            }
            Map<String, Object> map = objectMapper.readValue(resp.getBody(), new TypeReference<>() {});
            Object code = map.get("code");
            Object message = map.get("message");
            if (!(code instanceof Number n)) {
                return PushbackResult.failed("Missing code in response: " + resp.getBody());
            }
            return new PushbackResult(n.intValue(), message == null ? null : message.toString());
        } catch (RestClientException e) {
            log.error("Failed to call Bemfa push API: account={} topic={} error={}",
                    BemfaAccount.maskKey(accountKey), topic, e.getMessage());
            return PushbackResult.failed(e.getMessage());
        } catch (Exception e) {
            log.error("Failed to parse Bemfa push response: account={} topic={} error={}",
                    BemfaAccount.maskKey(accountKey), topic, e.getMessage());
            return PushbackResult.failed(e.getMessage());
        }
    }
}
