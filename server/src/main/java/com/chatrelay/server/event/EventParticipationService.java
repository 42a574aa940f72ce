package com.chatrelay.server.event;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.model.EventSummary;
import com.chatrelay.server.model.Identifiers;
import com.chatrelay.server.model.UserDetails;
import com.chatrelay.server.room.RoomKind;
import com.chatrelay.server.room.RoomName;
import com.chatrelay.server.room.RoomRouter;
import com.chatrelay.server.session.Session;
import com.chatrelay.server.store.EventStore;
import com.chatrelay.server.user.UserDetailCache;
import com.chatrelay.server.ws.EventNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * A participant changing their own RSVP for a calendar event.
 */
@Component
public class EventParticipationService {
    private static final Logger log = LoggerFactory.getLogger(EventParticipationService.class);

    static final Set<String> STATUSES = Set.of("invited", "accepted", "declined", "maybe");
    private static final String CREATOR_STATUS = "accepted";

    private final EventStore events;
    private final UserDetailCache userDetails;
    private final RoomRouter router;

    public EventParticipationService(EventStore events, UserDetailCache userDetails, RoomRouter router) {
        this.events = events;
        this.userDetails = userDetails;
        this.router = router;
    }

    public record StatusUpdated(String eventId, String userId, String newStatus, String username, String avatarPath) {
    }

    public record StatusAck(String eventId, String newStatus) {
    }

    public StatusUpdated updateMyStatus(Session session, String eventId, String status) {
        if (session == null) {
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Socket not authenticated");
        }
        if (!Identifiers.isUuid(eventId)) {
            throw new RealtimeException(ErrorCode.INVALID_EVENT_ID, "Invalid event ID format");
        }
        if (status == null || !STATUSES.contains(status)) {
            throw new RealtimeException(ErrorCode.INVALID_STATUS,
                    "Invalid status. Must be one of: invited, accepted, declined, maybe");
        }
        String userId = session.userId();
        EventSummary event = events.findEvent(eventId)
                .orElseThrow(() -> new RealtimeException(ErrorCode.EVENT_NOT_FOUND, "Event not found"));
        if (userId.equalsIgnoreCase(event.creatorId()) && !CREATOR_STATUS.equals(status)) {
            throw new RealtimeException(ErrorCode.CREATOR_STATUS_LOCKED, "Creator status is fixed as 'accepted'");
        }
        if (!events.isParticipant(userId, eventId)) {
            throw new RealtimeException(ErrorCode.NOT_PARTICIPANT, "You are not a participant of this event");
        }

        events.updateParticipantStatus(eventId, userId, status);
        log.info("[EVENT-STATUS] user={} event={} status={}", userId, eventId, status);

        UserDetails details = userDetails.getDetails(userId);
        StatusUpdated update = new StatusUpdated(eventId, userId, status, details.username(), details.avatarPath());
        router.broadcast(RoomName.of(RoomKind.EVENT, eventId), EventNames.EVENT_PARTICIPANT_STATUS_UPDATED, update);
        router.reply(session.connectionId(), EventNames.UPDATE_MY_EVENT_STATUS_SUCCESS, new StatusAck(eventId, status));
        return update;
    }
}
