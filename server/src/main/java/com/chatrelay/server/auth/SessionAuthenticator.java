package com.chatrelay.server.auth;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.model.Identifiers;
import com.chatrelay.server.presence.PresenceTracker;
import com.chatrelay.server.room.RoomKind;
import com.chatrelay.server.room.RoomName;
import com.chatrelay.server.room.RoomRouter;
import com.chatrelay.server.session.Registration;
import com.chatrelay.server.session.Session;
import org.springframework.stereotype.Component;

/**
 * Binds a connection to the user named by its token: registers the session,
 * updates presence and joins the personal rooms.
 */
@Component
public class SessionAuthenticator {

    private final TokenVerifier verifier;
    private final PresenceTracker presence;
    private final RoomRouter router;

    public SessionAuthenticator(TokenVerifier verifier, PresenceTracker presence, RoomRouter router) {
        this.verifier = verifier;
        this.presence = presence;
        this.router = router;
    }

    public Session authenticate(String connectionId, String token) {
        VerifiedToken verified = verifier.verify(token);
        if (!Identifiers.isUuid(verified.userId())) {
            throw new RealtimeException(ErrorCode.AUTH_FAILED, "Invalid user ID format");
        }
        VerifiedToken normalized = new VerifiedToken(Identifiers.normalize(verified.userId()), verified.username());
        Registration registration = presence.connect(connectionId, normalized);
        registration.displacedSession().ifPresent(d ->
                router.leave(connectionId, RoomName.of(RoomKind.USER, d.session().userId())));
        router.joinPersonalRooms(registration.session());
        return registration.session();
    }
}
