package com.chatrelay.server.room;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.model.ConversationKind;
import com.chatrelay.server.model.ConversationTarget;
import com.chatrelay.server.model.UserDetails;
import com.chatrelay.server.session.Session;
import com.chatrelay.server.store.TaskStore;
import com.chatrelay.server.user.UserDetailCache;
import com.chatrelay.server.ws.EventNames;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Client-initiated joins and leaves of conversation, task and event rooms.
 */
@Component
public class RoomSubscriptionService {
    private static final Logger log = LoggerFactory.getLogger(RoomSubscriptionService.class);

    private final RoomRouter router;
    private final TaskStore tasks;
    private final UserDetailCache userDetails;
    private final Clock clock;

    public RoomSubscriptionService(RoomRouter router, TaskStore tasks, UserDetailCache userDetails, Clock clock) {
        this.router = router;
        this.tasks = tasks;
        this.userDetails = userDetails;
        this.clock = clock;
    }

    public record UserJoined(
            @JsonProperty("dialog_id") String dialogId,
            @JsonProperty("group_id") String groupId,
            @JsonProperty("user_id") String userId,
            @JsonProperty("avatarUrl") String avatarUrl,
            @JsonProperty("joined_at") String joinedAt) {
    }

    public record EventRoomAck(String eventId, String room) {
    }

    public RoomName joinConversation(Session session, String dialogId, String groupId) {
        ConversationTarget target = ConversationTarget.resolve(dialogId, groupId);
        RoomKind kind = target.kind() == ConversationKind.DIALOG ? RoomKind.DIALOG : RoomKind.GROUP;
        RoomName room = router.authorizeAndJoin(session, kind, target.id());

        try {
            UserDetails details = userDetails.getDetails(session.userId());
            String event = kind == RoomKind.DIALOG ? EventNames.USER_JOINED_DIALOG : EventNames.USER_JOINED_GROUP;
            router.broadcast(room, event, new UserJoined(target.dialogId(), target.groupId(),
                    session.userId(), details.avatarPath(), clock.instant().toString()));
        } catch (RuntimeException e) {
            log.warn("[JOIN] join announcement failed room={} user={} err={}", room, session.userId(), e.toString());
        }
        return room;
    }

    public RoomName joinTaskDetails(Session session, String taskId) {
        RoomName room = router.authorizeAndJoin(session, RoomKind.TASK, taskId);
        tasks.findTask(room.entityId())
                .ifPresent(task -> router.broadcast(room, EventNames.TASK_STATUS, task));
        return room;
    }

    public RoomName leaveTaskDetails(Session session, String taskId) {
        RoomName room = RoomName.of(RoomKind.TASK, taskId);
        router.leave(session.connectionId(), room);
        return room;
    }

    public RoomName joinEventRoom(Session session, String eventId) {
        RoomName room = router.authorizeAndJoin(session, RoomKind.EVENT, requireEventId(eventId));
        router.reply(session.connectionId(), EventNames.JOIN_EVENT_ROOM_SUCCESS, new EventRoomAck(eventId, room.value()));
        return room;
    }

    public RoomName leaveEventRoom(Session session, String eventId) {
        RoomName room = RoomName.of(RoomKind.EVENT, requireEventId(eventId));
        router.leave(session.connectionId(), room);
        router.reply(session.connectionId(), EventNames.LEAVE_EVENT_ROOM_SUCCESS, new EventRoomAck(eventId, room.value()));
        return room;
    }

    private static String requireEventId(String eventId) {
        if (eventId == null || eventId.isEmpty()) {
            throw new RealtimeException(ErrorCode.MISSING_ID, "eventId is required");
        }
        return eventId;
    }
}
