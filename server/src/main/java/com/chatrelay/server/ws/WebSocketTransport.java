package com.chatrelay.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RealtimeTransport} over Spring WebSocket sessions. Each session is wrapped
 * in a {@link ConcurrentWebSocketSessionDecorator}, so a slow client fills its own
 * buffer and gets closed instead of stalling the sender.
 */
@Component
public class WebSocketTransport implements RealtimeTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private final Map<String, WebSocketSession> connections = new ConcurrentHashMap<>();
    private final RoomRegistry rooms;
    private final ObjectMapper mapper;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public WebSocketTransport(RoomRegistry rooms, ObjectMapper mapper,
                              @Value("${realtime.ws.send-time-limit-ms:5000}") int sendTimeLimitMs,
                              @Value("${realtime.ws.send-buffer-size-limit:65536}") int bufferSizeLimit) {
        this.rooms = rooms;
        this.mapper = mapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    public void open(WebSocketSession session) {
        connections.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));
    }

    /** Forgets a closed connection and every room it was in. */
    public void close(String connectionId) {
        connections.remove(connectionId);
        rooms.removeAll(connectionId);
    }

    public int openConnections() {
        return connections.size();
    }

    @Override
    public void join(String connectionId, String room) {
        rooms.add(room, connectionId);
    }

    @Override
    public void leave(String connectionId, String room) {
        rooms.remove(room, connectionId);
    }

    @Override
    public void leaveAll(String connectionId) {
        rooms.removeAll(connectionId);
    }

    @Override
    public void emitToRoom(String room, String event, Object payload, String excludedConnectionId) {
        TextMessage frame = encode(event, payload);
        if (frame == null) return;
        int sent = 0;
        for (String connectionId : rooms.members(room)) {
            if (connectionId.equals(excludedConnectionId)) continue;
            if (send(connectionId, frame)) sent++;
        }
        log.debug("[EMIT] room={} event={} recipients={}", room, event, sent);
    }

    @Override
    public void emitToConnection(String connectionId, String event, Object payload) {
        TextMessage frame = encode(event, payload);
        if (frame != null) send(connectionId, frame);
    }

    @Override
    public void emitToAll(String event, Object payload) {
        TextMessage frame = encode(event, payload);
        if (frame == null) return;
        for (String connectionId : connections.keySet()) {
            send(connectionId, frame);
        }
    }

    @Override
    public void disconnect(String connectionId) {
        WebSocketSession session = connections.remove(connectionId);
        rooms.removeAll(connectionId);
        if (session == null) return;
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("[WARN] close failed conn={} err={}", connectionId, e.getMessage());
        }
    }

    private boolean send(String connectionId, TextMessage frame) {
        WebSocketSession session = connections.get(connectionId);
        if (session == null || !session.isOpen()) return false;
        try {
            session.sendMessage(frame);
            return true;
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("[WARN] send failed conn={} err={}", connectionId, e.getMessage());
            return false;
        }
    }

    private TextMessage encode(String event, Object payload) {
        try {
            return new TextMessage(mapper.writeValueAsString(new OutboundFrame(event, payload)));
        } catch (JsonProcessingException e) {
            log.error("[ERROR] cannot serialize event={}", event, e);
            return null;
        }
    }
}
