package com.chatrelay.server.store;

import com.chatrelay.server.model.EventSummary;

import java.util.Optional;

public interface EventStore {

    Optional<EventSummary> findEvent(String eventId);

    /** True when the user created the event or is on its participant list. */
    boolean canAccessEvent(String userId, String eventId);

    boolean isParticipant(String userId, String eventId);

    void updateParticipantStatus(String eventId, String userId, String status);
}
