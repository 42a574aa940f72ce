package com.chatrelay.server.error;

/**
 * Rejection of a client operation. The WebSocket handler turns it into an
 * {@code <event>_failed} frame for the originating connection only.
 */
public class RealtimeException extends RuntimeException {

    private final ErrorCode code;

    public RealtimeException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
