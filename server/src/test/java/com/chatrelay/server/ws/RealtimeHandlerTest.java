package com.chatrelay.server.ws;

import com.chatrelay.server.auth.SessionAuthenticator;
import com.chatrelay.server.contact.ContactRelay;
import com.chatrelay.server.error.StoreException;
import com.chatrelay.server.event.EventParticipationService;
import com.chatrelay.server.message.MessageFanoutPipeline;
import com.chatrelay.server.model.ConversationTarget;
import com.chatrelay.server.presence.PresenceTracker;
import com.chatrelay.server.ratelimit.MessageRateLimiter;
import com.chatrelay.server.room.RoomRouter;
import com.chatrelay.server.room.RoomSubscriptionService;
import com.chatrelay.server.session.SessionRegistry;
import com.chatrelay.server.signal.TypingRelay;
import com.chatrelay.server.store.TaskStore;
import com.chatrelay.server.support.InMemoryConversationStore;
import com.chatrelay.server.support.InMemoryEventStore;
import com.chatrelay.server.support.InMemoryUserDirectory;
import com.chatrelay.server.support.MutableClock;
import com.chatrelay.server.support.TestRelay;
import com.chatrelay.server.user.UserDetailCache;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static com.chatrelay.server.support.Ids.ALICE;
import static com.chatrelay.server.support.Ids.BOB;
import static com.chatrelay.server.support.Ids.DIALOG;
import static com.chatrelay.server.support.Ids.TASK;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class RealtimeHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, List<JsonNode>> frames = new ConcurrentHashMap<>();

    private TaskStore tasks;
    private PresenceTracker presence;
    private RealtimeHandler handler;

    @BeforeEach
    public void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        SessionRegistry sessions = new SessionRegistry();
        InMemoryConversationStore conversations = new InMemoryConversationStore(clock);
        InMemoryUserDirectory users = new InMemoryUserDirectory();
        InMemoryEventStore events = new InMemoryEventStore();
        tasks = mock(TaskStore.class);

        users.put(ALICE, "alice", "/avatars/alice.png");
        users.put(BOB, "bob", "/avatars/bob.png");
        conversations.registerUser(ALICE, "alice");
        conversations.registerUser(BOB, "bob");
        conversations.addParticipants(ConversationTarget.dialog(DIALOG), ALICE, BOB);

        WebSocketTransport transport = new WebSocketTransport(new RoomRegistry(), mapper, 5000, 65536);
        RoomRouter router = new RoomRouter(transport, sessions, conversations, tasks, events);
        UserDetailCache userDetails = new UserDetailCache(users, clock, 300_000, 1_000);
        presence = new PresenceTracker(sessions, users, userDetails, router);
        SessionAuthenticator authenticator = new SessionAuthenticator(TestRelay.PLAIN_TOKENS, presence, router);
        MessageFanoutPipeline pipeline = new MessageFanoutPipeline(router, conversations,
                new MessageRateLimiter(10, 60_000, clock), userDetails, clock, 2000, 50);

        handler = new RealtimeHandler(mapper, transport, sessions, authenticator, presence,
                new RoomSubscriptionService(router, tasks, userDetails, clock), pipeline, new TypingRelay(router),
                new EventParticipationService(events, userDetails, router),
                new ContactRelay(users, userDetails, presence, router));
    }

    @Test
    public void shouldAuthenticateAndAnnounceOnline() {
        WebSocketSession alice = open("a1");

        send(alice, "{\"event\":\"authenticate\",\"data\":{\"token\":\"" + ALICE + ":alice\"}}");

        JsonNode authenticated = last("a1", "authenticated");
        assertEquals(ALICE, authenticated.path("userId").asText());
        assertEquals("alice", authenticated.path("username").asText());
        JsonNode status = last("a1", "userStatusChanged");
        assertTrue(status.path("isOnline").asBoolean());
        assertTrue(presence.isOnline(ALICE));
    }

    @Test
    public void shouldReportAuthenticationFailure() {
        WebSocketSession alice = open("a1");

        send(alice, "{\"event\":\"authenticate\",\"data\":{\"token\":\"garbage\"}}");

        assertEquals("AUTH_FAILED", last("a1", "authentication_failed").path("errorCode").asText());
        assertFalse(presence.isOnline(ALICE));
    }

    @Test
    public void shouldRejectOperationsBeforeAuthentication() {
        WebSocketSession anonymous = open("x1");

        send(anonymous, "{\"event\":\"joinDialog\",\"data\":{\"dialog_id\":\"" + DIALOG + "\"}}");
        send(anonymous, "{\"event\":\"sendMessage\",\"data\":{\"dialog_id\":\"" + DIALOG + "\",\"content\":\"hi\"}}");

        assertEquals("UNAUTHENTICATED", last("x1", "joinDialog_failed").path("errorCode").asText());
        assertEquals("UNAUTHENTICATED", last("x1", "sendMessage_failed").path("errorCode").asText());
    }

    @Test
    public void shouldDeliverMessageToRoomAsWireFrames() {
        WebSocketSession alice = authenticated("a1", ALICE, "alice");
        WebSocketSession bob = authenticated("b1", BOB, "bob");
        send(alice, "{\"event\":\"joinDialog\",\"data\":\"" + DIALOG + "\"}");
        send(bob, "{\"event\":\"joinDialog\",\"data\":{\"dialog_id\":\"" + DIALOG + "\"}}");

        send(alice, "{\"event\":\"sendMessage\",\"data\":{\"dialog_id\":\"" + DIALOG
                + "\",\"sender_id\":\"" + ALICE + "\",\"content\":\"hello bob\"}}");

        JsonNode message = last("b1", "newMessage");
        assertEquals("hello bob", message.path("content").asText());
        assertEquals(ALICE, message.path("sender_id").asText());
        assertEquals("alice", message.path("sender_username").asText());
        assertTrue(events("b1").contains("notification"));
    }

    @Test
    public void shouldReplyFailureOnlyToOrigin() {
        WebSocketSession alice = authenticated("a1", ALICE, "alice");
        authenticated("b1", BOB, "bob");
        int bobFrames = events("b1").size();

        send(alice, "{\"event\":\"sendMessage\",\"data\":{\"dialog_id\":\"" + DIALOG
                + "\",\"sender_id\":\"" + ALICE + "\",\"content\":\"   \"}}");

        JsonNode failure = last("a1", "sendMessage_failed");
        assertEquals("EMPTY_MESSAGE", failure.path("errorCode").asText());
        assertEquals(bobFrames, events("b1").size());
    }

    @Test
    public void shouldMapStoreAndUnexpectedFailures() {
        WebSocketSession alice = authenticated("a1", ALICE, "alice");
        when(tasks.canAccessTask(anyString(), anyString()))
                .thenThrow(new StoreException("connection refused", null))
                .thenThrow(new IllegalStateException("boom"));

        send(alice, "{\"event\":\"joinTaskDetails\",\"data\":\"" + TASK + "\"}");
        assertEquals("DB_ERROR", last("a1", "joinTaskDetails_failed").path("errorCode").asText());

        send(alice, "{\"event\":\"joinTaskDetails\",\"data\":{\"taskId\":\"" + TASK + "\"}}");
        assertEquals("SERVER_ERROR", last("a1", "joinTaskDetails_failed").path("errorCode").asText());
    }

    @Test
    public void shouldIgnoreMalformedAndUnknownFrames() {
        WebSocketSession alice = authenticated("a1", ALICE, "alice");
        int before = events("a1").size();

        send(alice, "not json");
        send(alice, "{\"data\":{}}");
        send(alice, "{\"event\":\"selfDestruct\",\"data\":{}}");

        assertEquals(before, events("a1").size());
    }

    @Test
    public void shouldRejectNonObjectPayload() {
        WebSocketSession alice = authenticated("a1", ALICE, "alice");

        send(alice, "{\"event\":\"markMessagesAsRead\",\"data\":42}");

        assertEquals("INVALID_INPUT", last("a1", "markMessagesAsRead_failed").path("errorCode").asText());
    }

    @Test
    public void shouldGoOfflineWhenLastConnectionCloses() {
        WebSocketSession laptop = authenticated("a1", ALICE, "alice");
        WebSocketSession phone = authenticated("a2", ALICE, "alice");
        authenticated("b1", BOB, "bob");

        handler.afterConnectionClosed(laptop, CloseStatus.GOING_AWAY);
        assertTrue(presence.isOnline(ALICE));

        handler.afterConnectionClosed(phone, CloseStatus.GOING_AWAY);
        assertFalse(presence.isOnline(ALICE));
        JsonNode status = last("b1", "userStatusChanged");
        assertEquals(ALICE, status.path("userId").asText());
        assertFalse(status.path("isOnline").asBoolean());
    }

    private WebSocketSession authenticated(String connectionId, String userId, String username) {
        WebSocketSession session = open(connectionId);
        send(session, "{\"event\":\"authenticate\",\"data\":{\"token\":\"" + userId + ":" + username + "\"}}");
        return session;
    }

    private WebSocketSession open(String connectionId) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(connectionId);
        when(session.isOpen()).thenReturn(true);
        List<JsonNode> received = new ArrayList<>();
        frames.put(connectionId, received);
        try {
            doAnswer(invocation -> {
                TextMessage message = invocation.getArgument(0);
                received.add(mapper.readTree(message.getPayload()));
                return null;
            }).when(session).sendMessage(any());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        handler.afterConnectionEstablished(session);
        return session;
    }

    private void send(WebSocketSession session, String payload) {
        handler.handleTextMessage(session, new TextMessage(payload));
    }

    private List<String> events(String connectionId) {
        return frames.get(connectionId).stream()
                .map(frame -> frame.path("event").asText())
                .collect(Collectors.toList());
    }

    private JsonNode last(String connectionId, String event) {
        JsonNode found = null;
        for (JsonNode frame : frames.get(connectionId)) {
            if (event.equals(frame.path("event").asText())) found = frame.path("data");
        }
        assertTrue(found != null, "no " + event + " frame for " + connectionId);
        return found;
    }
}
