package com.chatrelay.server.contact;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.model.Identifiers;
import com.chatrelay.server.model.UserDetails;
import com.chatrelay.server.presence.PresenceTracker;
import com.chatrelay.server.room.RoomRouter;
import com.chatrelay.server.session.Departure;
import com.chatrelay.server.session.Session;
import com.chatrelay.server.store.UserDirectory;
import com.chatrelay.server.user.UserDetailCache;
import com.chatrelay.server.ws.EventNames;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Contact list notifications. The contact rows themselves are written by the REST
 * service; this only tells the other side in real time.
 */
@Component
public class ContactRelay {
    private static final Logger log = LoggerFactory.getLogger(ContactRelay.class);

    private final UserDirectory users;
    private final UserDetailCache userDetails;
    private final PresenceTracker presence;
    private final RoomRouter router;

    public ContactRelay(UserDirectory users, UserDetailCache userDetails, PresenceTracker presence, RoomRouter router) {
        this.users = users;
        this.userDetails = userDetails;
        this.presence = presence;
        this.router = router;
    }

    public record ContactCard(String id, String username, String avatarUrl,
                              @JsonProperty("isOnline") boolean isOnline) {
    }

    public record ContactAdded(ContactCard contact) {
    }

    public record ContactRemoved(String userId, String username) {
    }

    /**
     * Tells the new contact that {@code session}'s user added them.
     *
     * @return whether the contact had a live session to receive it
     */
    public boolean contactAdded(Session session, String userId, String contactId) {
        if (session == null || userId == null || !session.userId().equalsIgnoreCase(userId)) {
            throw new RealtimeException(ErrorCode.AUTH_MISMATCH, "Authentication mismatch");
        }
        if (!Identifiers.isUuid(contactId)) {
            throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid contact ID format");
        }
        userDetails.getDetails(contactId);
        UserDetails me = userDetails.getDetails(session.userId());
        ContactCard card = new ContactCard(session.userId(), me.username(), me.avatarPath(),
                presence.isOnline(session.userId()));
        boolean delivered = router.unicast(Identifiers.normalize(contactId), EventNames.CONTACT_ADDED, new ContactAdded(card));
        log.info("[CONTACT-ADDED] user={} contact={} delivered={}", session.userId(), contactId, delivered);
        return delivered;
    }

    /**
     * Closes every connection of the account and tells its contacts it is gone. The
     * rows are deleted by the REST service.
     */
    public List<Departure> deleteAccount(Session session) {
        if (session == null) {
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Socket not authenticated");
        }
        String userId = session.userId();
        String username = session.username();
        try {
            username = userDetails.getDetails(userId).username();
        } catch (RealtimeException e) {
            log.debug("[DELETE-ACCOUNT] no cached details user={} code={}", userId, e.code());
        }
        List<String> contacts = users.findContactIds(userId);

        List<Departure> departures = presence.evict(userId);
        ContactRemoved removed = new ContactRemoved(userId, username);
        for (String contactId : contacts) {
            router.unicast(contactId, EventNames.CONTACT_REMOVED, removed);
        }
        log.info("[DELETE-ACCOUNT] user={} sessions={} contacts={}", userId, departures.size(), contacts.size());
        return departures;
    }
}
