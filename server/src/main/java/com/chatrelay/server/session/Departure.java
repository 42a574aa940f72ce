package com.chatrelay.server.session;

/**
 * A session that left the registry, with the number of sessions its user still
 * holds after the removal.
 */
public record Departure(Session session, int remainingSessions) {

    public boolean lastForUser() {
        return remainingSessions == 0;
    }
}
