package com.chatrelay.server.room;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.model.ConversationTarget;
import com.chatrelay.server.model.TaskSnapshot;
import com.chatrelay.server.session.Session;
import com.chatrelay.server.support.TestRelay;
import com.chatrelay.server.ws.EventNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.chatrelay.server.support.Ids.ALICE;
import static com.chatrelay.server.support.Ids.BOB;
import static com.chatrelay.server.support.Ids.DIALOG;
import static com.chatrelay.server.support.Ids.EVENT;
import static com.chatrelay.server.support.Ids.GROUP;
import static com.chatrelay.server.support.Ids.TASK;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RoomSubscriptionServiceTest {

    private TestRelay relay;
    private Session alice;
    private Session bob;

    @BeforeEach
    public void setUp() {
        relay = new TestRelay();
        relay.addUser(ALICE, "alice");
        relay.addUser(BOB, "bob");
        relay.conversations.addParticipants(ConversationTarget.dialog(DIALOG), ALICE, BOB);
        alice = relay.connect("a1", ALICE, "alice");
        bob = relay.connect("b1", BOB, "bob");
        relay.transport.clear();
    }

    @Test
    public void shouldAnnounceDialogJoinToRoom() {
        relay.subscriptions.joinConversation(bob, DIALOG, null);
        relay.subscriptions.joinConversation(alice, DIALOG, null);

        List<RoomSubscriptionService.UserJoined> seen = relay.transport.payloadsTo("b1",
                EventNames.USER_JOINED_DIALOG, RoomSubscriptionService.UserJoined.class);
        assertEquals(2, seen.size());
        assertEquals(ALICE, seen.get(1).userId());
        assertEquals("/avatars/alice.png", seen.get(1).avatarUrl());
        assertEquals("2026-01-01T00:00:00Z", seen.get(1).joinedAt());
    }

    @Test
    public void shouldRejectGroupJoinForNonMember() {
        RealtimeException e = assertThrows(RealtimeException.class,
                () -> relay.subscriptions.joinConversation(alice, null, GROUP));
        assertEquals(ErrorCode.NOT_PARTICIPANT, e.code());
        assertEquals(0, relay.transport.totalDeliveries());
    }

    @Test
    public void shouldJoinTaskAndPublishStatus() {
        relay.tasks.put(TASK, "Ship it", "in_progress", ALICE, null);

        relay.subscriptions.joinTaskDetails(alice, TASK);

        TaskSnapshot status = relay.transport.payloadsTo("a1", EventNames.TASK_STATUS, TaskSnapshot.class).get(0);
        assertEquals("Ship it", status.title());
        assertEquals("in_progress", status.status());

        relay.subscriptions.leaveTaskDetails(alice, TASK);
        assertFalse(relay.transport.roomsOf("a1").contains("task:" + TASK));

        RealtimeException e = assertThrows(RealtimeException.class,
                () -> relay.subscriptions.joinTaskDetails(bob, TASK));
        assertEquals(ErrorCode.ACCESS_DENIED, e.code());
    }

    @Test
    public void shouldAcknowledgeEventRoomJoinAndLeave() {
        relay.events.put(EVENT, ALICE);

        relay.subscriptions.joinEventRoom(alice, EVENT);
        assertTrue(relay.transport.roomsOf("a1").contains("event:" + EVENT));
        RoomSubscriptionService.EventRoomAck ack = relay.transport.payloadsTo("a1",
                EventNames.JOIN_EVENT_ROOM_SUCCESS, RoomSubscriptionService.EventRoomAck.class).get(0);
        assertEquals(new RoomSubscriptionService.EventRoomAck(EVENT, "event:" + EVENT), ack);

        relay.subscriptions.leaveEventRoom(alice, EVENT);
        assertFalse(relay.transport.roomsOf("a1").contains("event:" + EVENT));
        assertEquals(1, relay.transport.payloadsTo("a1", EventNames.LEAVE_EVENT_ROOM_SUCCESS,
                RoomSubscriptionService.EventRoomAck.class).size());

        assertEquals(ErrorCode.ACCESS_DENIED, assertThrows(RealtimeException.class,
                () -> relay.subscriptions.joinEventRoom(bob, EVENT)).code());
        assertEquals(ErrorCode.INVALID_ID, assertThrows(RealtimeException.class,
                () -> relay.subscriptions.joinEventRoom(bob, "x")).code());
    }
}
