package com.livedesk.relay.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * REST envelope. Failures carry the same machine code / human message pair as WebSocket ERROR frames.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean ok, T data, String error, String message) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null);
    }

    public static <T> ApiResponse<T> error(String code, String message) {
        return new ApiResponse<>(false, null, code, message);
    }
}
