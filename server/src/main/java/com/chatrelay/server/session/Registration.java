package com.chatrelay.server.session;

import java.util.Optional;

/**
 * Result of {@link SessionRegistry#register}. {@code displaced} is set when the
 * connection was previously bound to a different user.
 */
public record Registration(Session session, int sessionsForUser, boolean firstForUser, Departure displaced) {

    public Optional<Departure> displacedSession() {
        return Optional.ofNullable(displaced);
    }
}
