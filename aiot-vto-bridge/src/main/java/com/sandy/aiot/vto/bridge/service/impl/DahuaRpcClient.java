package com.sandy.aiot.vto.bridge.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.sandy.aiot.vto.bridge.exception.DahuaProtocolException;
import com.sandy.aiot.vto.bridge.vo.DoorOpenResult;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.DigestUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC client for one Dahua VTO door station.
 * <p>
 * Login is a two-phase challenge: the first {@code global.login} returns realm/random, the second
 * carries {@code MD5(user:random:MD5(user:realm:password))}. Every later call is scoped to the
 * session token returned at login. Instances are cheap and meant to be used for one flow.
 */
@Slf4j
public class DahuaRpcClient {

    public static final String STEP_LOGIN = "login";
    public static final String STEP_GET_DOOR_INSTANCE = "getDoorInstance";
    public static final String STEP_OPEN_DOOR = "openDoor";
    public static final String STEP_DESTROY_DOOR_INSTANCE = "destroyDoorInstance";
    public static final String STEP_LOGOUT = "logout";

    static final String LOGIN_PATH = "/RPC2_Login";
    static final String RPC_PATH = "/RPC2";
    static final int FIRST_REQUEST_ID = 1000;
    private static final String OPEN_TYPE = "Remote";
    private static final String CLIENT_TYPE = "GUI";

    private final String address;
    private final String username;
    private final String password;
    private final String loginUrl;
    private final String rpcUrl;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AtomicInteger requestId = new AtomicInteger(FIRST_REQUEST_ID);

    /**
     * Session of one actuation attempt.
     */
    @Value
    static class RpcSession {
        JsonNode token;
    }

    public DahuaRpcClient(String address, int port, String username, String password,
                          RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.address = address;
        this.username = username;
        this.password = password;
        this.loginUrl = "http://" + address + ":" + port + LOGIN_PATH;
        this.rpcUrl = "http://" + address + ":" + port + RPC_PATH;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs login, door instance, open, destroy and logout in order.
     *
     * @param doorIndex   door index on the unit, usually 0
     * @param shortNumber site short number required by the open call
     * @return the result; never throws
     */
    public DoorOpenResult executeOpenFlow(int doorIndex, String shortNumber) {
        RpcSession session;
        try {
            session = login();
        } catch (DahuaProtocolException e) {
            log.error("Dahua login failed [address={}; step={}]: {}", address, e.getStep(), e.getMessage());
            return DoorOpenResult.failure(STEP_LOGIN, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Dahua login failed unexpectedly [address={}]: {}", address, e.getMessage(), e);
            return DoorOpenResult.failure(STEP_LOGIN, e.getMessage());
        }

        try {
            JsonNode handle = getDoorInstance(session);
            log.info("Door instance acquired [address={}; handle={}]", address, handle);
            boolean opened = openDoor(session, handle, doorIndex, shortNumber);
            log.info("Open door result [address={}; opened={}]", address, opened);
            boolean destroyed = destroyDoorInstance(session, handle);
            boolean loggedOut = logout(session);

            DoorOpenResult result = DoorOpenResult.builder()
                    .success(opened)
                    .step(opened ? null : STEP_OPEN_DOOR)
                    .message(opened ? "Door opened" : "Door station rejected the open request")
                    .build();
            result.getDiagnostics().put("doorHandle", handle.isNumber() ? handle.numberValue() : handle.asText());
            result.getDiagnostics().put("openResult", opened);
            result.getDiagnostics().put("destroyResult", destroyed);
            result.getDiagnostics().put("logoutResult", loggedOut);
            return result;
        } catch (DahuaProtocolException e) {
            log.error("Door open flow aborted [address={}; step={}]: {}", address, e.getStep(), e.getMessage());
            logout(session);
            return DoorOpenResult.failure(e.getStep(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Door open flow failed unexpectedly [address={}]: {}", address, e.getMessage(), e);
            logout(session);
            return DoorOpenResult.failure("unknown", e.getMessage());
        }
    }

    RpcSession login() {
        Map<String, Object> challengeParams = new LinkedHashMap<>();
        challengeParams.put("userName", username);
        challengeParams.put("password", "");
        challengeParams.put("clientType", CLIENT_TYPE);
        JsonNode challenge = post(STEP_LOGIN, loginUrl, request("global.login", challengeParams, null, IntNode.valueOf(0)));
        JsonNode token = challenge.get("session");

        if (challenge.path("result").asBoolean(false)) {
            log.info("Dahua unit {} accepted login without password", address);
            return new RpcSession(token);
        }

        JsonNode params = challenge.path("params");
        String realm = requireText(params, "realm");
        String random = requireText(params, "random");
        String encryption = requireText(params, "encryption");
        if (token == null || token.isNull()) {
            throw DahuaProtocolException.malformed(STEP_LOGIN, "challenge without session");
        }

        Map<String, Object> loginParams = new LinkedHashMap<>();
        loginParams.put("userName", username);
        loginParams.put("password", computeDigest(username, password, realm, random));
        loginParams.put("clientType", CLIENT_TYPE);
        loginParams.put("realm", realm);
        loginParams.put("random", random);
        loginParams.put("passwordType", "Default");
        loginParams.put("authorityType", encryption);
        JsonNode result = post(STEP_LOGIN, loginUrl, request("global.login", loginParams, null, token));
        if (!result.path("result").asBoolean(false)) {
            throw new DahuaProtocolException(STEP_LOGIN, "Login rejected: " + errorMessage(result));
        }
        JsonNode issued = result.get("session");
        log.info("Dahua unit {} login succeeded", address);
        return new RpcSession(issued == null || issued.isNull() ? token : issued);
    }

    JsonNode getDoorInstance(RpcSession session) {
        JsonNode result = post(STEP_GET_DOOR_INSTANCE, rpcUrl,
                request("accessControl.factory.instance", Map.of("channel", 0), null, session.getToken()));
        JsonNode handle = result.get("result");
        if (handle == null || handle.isNull() || handle.isBoolean()) {
            throw new DahuaProtocolException(STEP_GET_DOOR_INSTANCE, "No door instance: " + errorMessage(result));
        }
        return handle;
    }

    boolean openDoor(RpcSession session, JsonNode handle, int doorIndex, String shortNumber) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("DoorIndex", doorIndex);
        params.put("ShortNumber", shortNumber);
        params.put("Type", OPEN_TYPE);
        JsonNode result = post(STEP_OPEN_DOOR, rpcUrl, request("accessControl.openDoor", params, handle, session.getToken()));
        return result.path("result").asBoolean(false);
    }

    boolean destroyDoorInstance(RpcSession session, JsonNode handle) {
        JsonNode result = post(STEP_DESTROY_DOOR_INSTANCE, rpcUrl,
                request("accessControl.destroy", null, handle, session.getToken()));
        return result.path("result").asBoolean(false);
    }

    /**
     * Best effort; failures are logged and reported as false.
     */
    boolean logout(RpcSession session) {
        if (session == null || session.getToken() == null) {
            return true;
        }
        try {
            JsonNode result = post(STEP_LOGOUT, rpcUrl, request("global.logout", null, null, session.getToken()));
            boolean success = result.path("result").asBoolean(false);
            if (success) {
                log.info("Dahua unit {} logged out", address);
            }
            return success;
        } catch (RuntimeException e) {
            log.warn("Dahua logout failed [address={}]: {}", address, e.getMessage());
            return false;
        }
    }

    /**
     * Second-phase login password: {@code upper(md5(user:random:upper(md5(user:realm:password))))}.
     */
    public static String computeDigest(String username, String password, String realm, String random) {
        String first = md5Upper(username + ":" + realm + ":" + password);
        return md5Upper(username + ":" + random + ":" + first);
    }

    private static String md5Upper(String text) {
        return DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8)).toUpperCase(Locale.ROOT);
    }

    private Map<String, Object> request(String method, Object params, JsonNode object, JsonNode session) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", requestId.incrementAndGet());
        body.put("method", method);
        if (object != null) {
            body.put("object", object);
        }
        if (params != null) {
            body.put("params", params);
        }
        body.put("session", session);
        return body;
    }

    private JsonNode post(String step, String url, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new DahuaProtocolException(step, "Invalid device address: " + address, e);
        }
        ResponseEntity<String> resp;
        try {
            String json = objectMapper.writeValueAsString(body);
            resp = restTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(json, headers), String.class);
        } catch (HttpStatusCodeException e) {
            throw DahuaProtocolException.badStatus(step, e.getStatusCode().value());
        } catch (RestClientException e) {
            throw DahuaProtocolException.network(step, e);
        } catch (JsonProcessingException e) {
            throw new DahuaProtocolException(step, "Cannot encode request: " + e.getOriginalMessage(), e);
        }
        if (!resp.getStatusCode().is2xxSuccessful()) {
            throw DahuaProtocolException.badStatus(step, resp.getStatusCode().value());
        }
        if (resp.getBody() == null || resp.getBody().isBlank()) {
            throw DahuaProtocolException.malformed(step, "empty body");
        }
        try {
            JsonNode node = objectMapper.readTree(resp.getBody());
            if (node == null || !node.isObject()) {
                throw DahuaProtocolException.malformed(step, "not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw DahuaProtocolException.malformed(step, e.getOriginalMessage());
        }
    }

    private static String requireText(JsonNode params, String field) {
        JsonNode value = params.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            throw DahuaProtocolException.malformed(STEP_LOGIN, "challenge without " + field);
        }
        return value.asText();
    }

    private static String errorMessage(JsonNode result) {
        return result.path("error").path("message").asText("unknown error");
    }
}
