package com.chatrelay.server.ws;

import com.chatrelay.server.auth.SessionAuthenticator;
import com.chatrelay.server.contact.ContactRelay;
import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.error.StoreException;
import com.chatrelay.server.event.EventParticipationService;
import com.chatrelay.server.message.DeleteMessageRequest;
import com.chatrelay.server.message.EditMessageRequest;
import com.chatrelay.server.message.ForwardMessagesRequest;
import com.chatrelay.server.message.MarkReadRequest;
import com.chatrelay.server.message.MessageFanoutPipeline;
import com.chatrelay.server.message.SendMessageRequest;
import com.chatrelay.server.presence.PresenceTracker;
import com.chatrelay.server.room.RoomSubscriptionService;
import com.chatrelay.server.session.Session;
import com.chatrelay.server.session.SessionRegistry;
import com.chatrelay.server.signal.TypingRelay;
import com.chatrelay.server.signal.TypingRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Set;

/**
 * Entry point of every client frame.
 * - 连接建立：登记连接，等待 authenticate
 * - 收到文本：解析 {event, data}，分发到对应的服务；任何拒绝只回给发起连接 {event}_failed
 * - 连接关闭：注销会话、离开所有房间，必要时广播离线
 *
 * <p>The container delivers one session's frames sequentially, so operations from a
 * single connection run in arrival order.
 */
@Component
public class RealtimeHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(RealtimeHandler.class);

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final ObjectMapper mapper;
    private final WebSocketTransport transport;
    private final SessionRegistry sessions;
    private final SessionAuthenticator authenticator;
    private final PresenceTracker presence;
    private final RoomSubscriptionService subscriptions;
    private final MessageFanoutPipeline pipeline;
    private final TypingRelay typing;
    private final EventParticipationService eventParticipation;
    private final ContactRelay contacts;

    public RealtimeHandler(ObjectMapper mapper, WebSocketTransport transport, SessionRegistry sessions,
                           SessionAuthenticator authenticator, PresenceTracker presence,
                           RoomSubscriptionService subscriptions, MessageFanoutPipeline pipeline,
                           TypingRelay typing, EventParticipationService eventParticipation,
                           ContactRelay contacts) {
        this.mapper = mapper;
        this.transport = transport;
        this.sessions = sessions;
        this.authenticator = authenticator;
        this.presence = presence;
        this.subscriptions = subscriptions;
        this.pipeline = pipeline;
        this.typing = typing;
        this.eventParticipation = eventParticipation;
        this.contacts = contacts;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        transport.open(session);
        log.info("[OPEN] conn={} open={}", session.getId(), transport.openConnections());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // 1) 解析 JSON -> InboundFrame
        InboundFrame frame;
        try {
            frame = mapper.readValue(message.getPayload(), InboundFrame.class);
        } catch (JsonProcessingException e) {
            log.warn("[WARN] invalid json conn={} err={}", session.getId(), e.getOriginalMessage());
            return;
        }

        // 2) Bean 校验
        Set<ConstraintViolation<InboundFrame>> violations = validator.validate(frame);
        if (!violations.isEmpty()) {
            log.warn("[WARN] invalid frame conn={} violations={}", session.getId(), violations.size());
            return;
        }

        // 3) 分发
        dispatch(session.getId(), frame);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WARN] transport error conn={} err={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = session.getId();
        presence.disconnect(connectionId);
        transport.close(connectionId);
        log.info("[CLOSE] conn={} code={} open={}", connectionId, status.getCode(), transport.openConnections());
    }

    void dispatch(String connectionId, InboundFrame frame) {
        String event = frame.event;
        JsonNode data = frame.data;
        Session session = sessions.lookup(connectionId).orElse(null);
        try {
            switch (event) {
                case "authenticate" -> {
                    Session authenticated = authenticator.authenticate(connectionId, field(data, "token"));
                    transport.emitToConnection(connectionId, EventNames.AUTHENTICATED,
                            new Authenticated(authenticated.userId(), authenticated.username()));
                }
                case "joinConversation" -> subscriptions.joinConversation(
                        require(session), member(data, "dialog_id"), member(data, "group_id"));
                case "joinDialog" -> subscriptions.joinConversation(require(session), field(data, "dialog_id"), null);
                case "joinGroup" -> subscriptions.joinConversation(require(session), null, field(data, "group_id"));
                case "sendMessage" -> pipeline.sendMessage(session, read(data, SendMessageRequest.class));
                case "editMessage" -> pipeline.editMessage(session, read(data, EditMessageRequest.class));
                case "deleteMessage" -> pipeline.deleteMessage(session, read(data, DeleteMessageRequest.class));
                case "markMessagesAsRead" -> pipeline.markMessagesAsRead(session, read(data, MarkReadRequest.class));
                case "forwardMessages" -> transport.emitToConnection(connectionId, EventNames.MESSAGES_FORWARDED,
                        pipeline.forwardMessages(session, read(data, ForwardMessagesRequest.class)));
                case "start_typing" -> relayTyping(session, connectionId, data, true);
                case "stop_typing" -> relayTyping(session, connectionId, data, false);
                case "joinTaskDetails" -> subscriptions.joinTaskDetails(require(session), field(data, "taskId"));
                case "leaveTaskDetails" -> subscriptions.leaveTaskDetails(require(session), field(data, "taskId"));
                case "joinEventRoom" -> subscriptions.joinEventRoom(require(session), field(data, "eventId"));
                case "leaveEventRoom" -> subscriptions.leaveEventRoom(require(session), field(data, "eventId"));
                case "updateMyEventStatus" -> eventParticipation.updateMyStatus(
                        session, member(data, "eventId"), member(data, "status"));
                case "contactAdded" -> contacts.contactAdded(
                        session, member(data, "user_id"), member(data, "contact_id"));
                case "deleteAccount" -> contacts.deleteAccount(session);
                default -> log.warn("[WARN] unknown event={} conn={}", event, connectionId);
            }
        } catch (RealtimeException e) {
            reject(connectionId, event, session, data, e.code(), e.getMessage());
        } catch (StoreException e) {
            log.error("[STORE] event={} conn={} failed", event, connectionId, e);
            reject(connectionId, event, session, data, ErrorCode.DB_ERROR, "Database error");
        } catch (RuntimeException e) {
            log.error("[ERROR] event={} conn={} failed", event, connectionId, e);
            reject(connectionId, event, session, data, ErrorCode.SERVER_ERROR, "Internal server error");
        }
    }

    private void relayTyping(Session session, String connectionId, JsonNode data, boolean started) {
        TypingRequest request;
        try {
            request = read(data, TypingRequest.class);
        } catch (RealtimeException e) {
            log.debug("[TYPING-DROP] conn={} reason=payload", connectionId);
            return;
        }
        typing.relay(session, connectionId, request, started);
    }

    private void reject(String connectionId, String event, Session session, JsonNode data,
                        ErrorCode code, String message) {
        log.warn("[REJECT] event={} user={} target={} code={} msg={}",
                event, session == null ? null : session.userId(), describeTarget(data), code, message);
        transport.emitToConnection(connectionId, EventNames.failed(event), new FailurePayload(code.name(), message));
    }

    private static Session require(Session session) {
        if (session == null) {
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Socket not authenticated");
        }
        return session;
    }

    private <T> T read(JsonNode data, Class<T> type) {
        if (data == null || !data.isObject()) {
            throw new RealtimeException(ErrorCode.INVALID_INPUT, "Payload must be an object");
        }
        try {
            return mapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new RealtimeException(ErrorCode.INVALID_INPUT, "Malformed payload");
        }
    }

    /** Accepts either a bare string payload or an object carrying {@code name}. */
    private static String field(JsonNode data, String name) {
        if (data == null || data.isNull()) return null;
        if (data.isTextual()) return data.asText();
        JsonNode value = data.get(name);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String member(JsonNode data, String name) {
        if (data == null || !data.isObject()) return null;
        JsonNode value = data.get(name);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String describeTarget(JsonNode data) {
        if (data == null) return null;
        if (data.isTextual()) return data.asText();
        for (String key : new String[]{"dialog_id", "group_id", "message_id", "taskId", "eventId", "contact_id"}) {
            JsonNode value = data.get(key);
            if (value != null && value.isTextual()) return key + ":" + value.asText();
        }
        return null;
    }

    public record Authenticated(String userId, String username) {
    }
}
