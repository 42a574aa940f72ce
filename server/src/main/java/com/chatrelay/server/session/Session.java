package com.chatrelay.server.session;

/** One authenticated transport connection. */
public record Session(String connectionId, String userId, String username) {
}
