package com.chatrelay.server.presence;

import com.chatrelay.server.auth.VerifiedToken;
import com.chatrelay.server.model.UserDetails;
import com.chatrelay.server.room.RoomRouter;
import com.chatrelay.server.session.Departure;
import com.chatrelay.server.session.Registration;
import com.chatrelay.server.session.SessionRegistry;
import com.chatrelay.server.store.UserDirectory;
import com.chatrelay.server.user.UserDetailCache;
import com.chatrelay.server.ws.EventNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Online/offline state derived from the session count. A user goes online with the
 * first session and offline only when the registry reports zero remaining, so a
 * second device closing never flips the status. Status writes and broadcasts are
 * best effort: failures are logged and never reach the client.
 *
 * <p>Publishing runs outside the registry lock, so a last-device close and a
 * first-device reconnect of the same user can race. Each publish re-reads the live
 * session count before the write and again before the broadcast and drops itself once
 * it no longer matches, so the transition that lost the race never lands after the
 * one that won.
 */
@Component
public class PresenceTracker {
    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    private final SessionRegistry sessions;
    private final UserDirectory users;
    private final UserDetailCache userDetails;
    private final RoomRouter router;

    public PresenceTracker(SessionRegistry sessions, UserDirectory users,
                           UserDetailCache userDetails, RoomRouter router) {
        this.sessions = sessions;
        this.users = users;
        this.userDetails = userDetails;
        this.router = router;
    }

    public Registration connect(String connectionId, VerifiedToken token) {
        Registration registration = sessions.register(connectionId, token.userId(), token.username());
        registration.displacedSession().ifPresent(this::onDeparture);
        log.info("[CONNECT] user={} conn={} sessions={}",
                token.userId(), connectionId, registration.sessionsForUser());
        if (registration.firstForUser()) {
            publish(token.userId(), true);
        }
        return registration;
    }

    public Optional<Departure> disconnect(String connectionId) {
        Optional<Departure> departure = sessions.unregister(connectionId);
        departure.ifPresent(this::onDeparture);
        return departure;
    }

    /**
     * Drops every session of the user and closes their connections. The offline
     * status goes out once, however many devices were connected.
     */
    public List<Departure> evict(String userId) {
        List<Departure> departures = sessions.unregisterAll(userId);
        for (Departure d : departures) {
            router.disconnect(d.session().connectionId());
        }
        if (!departures.isEmpty()) {
            log.info("[EVICT] user={} sessions={}", userId, departures.size());
            publish(userId, false);
        }
        return departures;
    }

    public boolean isOnline(String userId) {
        return sessions.countSessionsFor(userId) > 0;
    }

    private boolean isStale(String userId, boolean online) {
        if (isOnline(userId) == online) return false;
        log.info("[PRESENCE-SKIP] user={} online={} reason=superseded", userId, online);
        return true;
    }

    private void onDeparture(Departure departure) {
        String userId = departure.session().userId();
        log.info("[DISCONNECT] user={} conn={} remaining={}",
                userId, departure.session().connectionId(), departure.remainingSessions());
        if (departure.lastForUser()) {
            publish(userId, false);
        }
    }

    private void publish(String userId, boolean online) {
        if (isStale(userId, online)) return;
        try {
            users.setOnlineStatus(userId, online);
        } catch (RuntimeException e) {
            log.warn("[PRESENCE] status write failed user={} online={} err={}", userId, online, e.toString());
        }
        if (isStale(userId, online)) return;
        try {
            UserDetails details = userDetails.getDetails(userId);
            router.broadcastAll(EventNames.USER_STATUS_CHANGED,
                    new UserStatusChanged(userId, online, details.username(), details.avatarPath()));
            log.info("[PRESENCE] user={} online={}", userId, online);
        } catch (RuntimeException e) {
            log.warn("[PRESENCE] status broadcast failed user={} online={} err={}", userId, online, e.toString());
        }
    }
}
