package com.chatrelay.server.room;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.model.ConversationKind;
import com.chatrelay.server.model.ConversationTarget;
import com.chatrelay.server.model.Identifiers;
import com.chatrelay.server.session.Session;
import com.chatrelay.server.session.SessionRegistry;
import com.chatrelay.server.store.ConversationStore;
import com.chatrelay.server.store.EventStore;
import com.chatrelay.server.store.TaskStore;
import com.chatrelay.server.ws.RealtimeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Room naming, authorized joins and delivery. Every join re-checks access against
 * the store; nothing about membership is cached here.
 */
@Component
public class RoomRouter {
    private static final Logger log = LoggerFactory.getLogger(RoomRouter.class);

    private final RealtimeTransport transport;
    private final SessionRegistry sessions;
    private final ConversationStore conversations;
    private final TaskStore tasks;
    private final EventStore events;

    public RoomRouter(RealtimeTransport transport, SessionRegistry sessions,
                      ConversationStore conversations, TaskStore tasks, EventStore events) {
        this.transport = transport;
        this.sessions = sessions;
        this.conversations = conversations;
        this.tasks = tasks;
        this.events = events;
    }

    public RoomName roomNameFor(RoomKind kind, String id) {
        return RoomName.of(kind, id);
    }

    public RoomName roomFor(ConversationTarget target) {
        RoomKind kind = target.kind() == ConversationKind.DIALOG ? RoomKind.DIALOG : RoomKind.GROUP;
        return RoomName.of(kind, target.id());
    }

    /**
     * Checks that the session may enter the room and joins it.
     *
     * @throws RealtimeException {@code INVALID_ID}, {@code NOT_PARTICIPANT} or {@code ACCESS_DENIED}
     */
    public RoomName authorizeAndJoin(Session session, RoomKind kind, String id) {
        RoomName room = RoomName.of(kind, id);
        authorize(session, room);
        transport.join(session.connectionId(), room.value());
        log.info("[JOIN] room={} user={} conn={}", room, session.userId(), session.connectionId());
        return room;
    }

    /** Personal room plus the shared task feed, joined right after authentication. */
    public void joinPersonalRooms(Session session) {
        transport.join(session.connectionId(), RoomName.of(RoomKind.USER, session.userId()).value());
        transport.join(session.connectionId(), RoomName.generalTasks().value());
    }

    public void leave(String connectionId, RoomName room) {
        transport.leave(connectionId, room.value());
        log.info("[LEAVE] room={} conn={}", room, connectionId);
    }

    public void broadcast(RoomName room, String event, Object payload) {
        transport.emitToRoom(room.value(), event, payload, null);
    }

    public void broadcastExcept(RoomName room, String event, Object payload, String excludedConnectionId) {
        transport.emitToRoom(room.value(), event, payload, excludedConnectionId);
    }

    public void broadcastAll(String event, Object payload) {
        transport.emitToAll(event, payload);
    }

    public void reply(String connectionId, String event, Object payload) {
        transport.emitToConnection(connectionId, event, payload);
    }

    /**
     * Delivers to every live session of a user through the personal room.
     *
     * @return false when the user has no live session and nothing was sent
     */
    public boolean unicast(String userId, String event, Object payload) {
        if (!Identifiers.isUuid(userId)) {
            log.warn("[UNICAST-SKIP] user={} event={} reason=invalid-id", userId, event);
            return false;
        }
        userId = Identifiers.normalize(userId);
        if (sessions.countSessionsFor(userId) == 0) {
            log.debug("[UNICAST-SKIP] user={} event={} reason=offline", userId, event);
            return false;
        }
        broadcast(RoomName.of(RoomKind.USER, userId), event, payload);
        return true;
    }

    public void disconnect(String connectionId) {
        transport.leaveAll(connectionId);
        transport.disconnect(connectionId);
    }

    private void authorize(Session session, RoomName room) {
        String userId = session.userId();
        switch (room.kind()) {
            case USER -> {
                if (!room.entityId().equalsIgnoreCase(userId)) {
                    throw new RealtimeException(ErrorCode.ACCESS_DENIED, "Cannot join another user's room");
                }
            }
            case DIALOG -> requireParticipant(userId, ConversationTarget.dialog(room.entityId()));
            case GROUP -> requireParticipant(userId, ConversationTarget.group(room.entityId()));
            case TASK -> {
                if (!tasks.canAccessTask(userId, room.entityId())) {
                    throw new RealtimeException(ErrorCode.ACCESS_DENIED, "You do not have access to this task");
                }
            }
            case EVENT -> {
                if (!events.canAccessEvent(userId, room.entityId())) {
                    throw new RealtimeException(ErrorCode.ACCESS_DENIED, "You do not have access to this event");
                }
            }
            case GENERAL_TASKS -> {
            }
        }
    }

    /**
     * @throws RealtimeException {@code NOT_PARTICIPANT} when the store says no
     */
    public void requireParticipant(String userId, ConversationTarget target) {
        if (!conversations.isParticipant(userId, target)) {
            throw new RealtimeException(ErrorCode.NOT_PARTICIPANT,
                    "You are not a participant of this " + target.kind().label());
        }
    }
}
