package com.sandy.aiot.vto.bridge.vo;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one door-open flow. {@code step} names the RPC step that failed, null on success.
 */
@Data
@Builder
public class DoorOpenResult {
    private boolean success;
    private String step;
    private String message;
    @Builder.Default
    private Map<String, Object> diagnostics = new LinkedHashMap<>();

    public static DoorOpenResult failure(String step, String message) {
        return DoorOpenResult.builder().success(false).step(step).message(message).build();
    }
}
