package com.sandy.aiot.vto.bridge.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bemfa API answer; code 0 means accepted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PushbackResult {
    private int code;
    private String message;

    public boolean isSuccess() {
        return code == 0;
    }

    public static PushbackResult failed(String message) {
        return new PushbackResult(-1, message);
    }
}
