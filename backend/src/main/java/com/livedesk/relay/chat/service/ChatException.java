package com.livedesk.relay.chat.service;

public class ChatException extends RuntimeException {

    private final ChatFailure failure;
    private final String code;

    public ChatException(ChatFailure failure, String code, String message) {
        super(message);
        this.failure = failure;
        this.code = code;
    }

    public ChatFailure failure() {
        return failure;
    }

    public String code() {
        return code;
    }
}
