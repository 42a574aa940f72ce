package com.chatrelay.server.signal;

import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.model.ConversationTarget;
import com.chatrelay.server.room.RoomRouter;
import com.chatrelay.server.session.Session;
import com.chatrelay.server.ws.EventNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Relays typing indicators to the other connections of a room. Nothing is stored and
 * nothing is reported back: a dropped signal is only logged.
 */
@Component
public class TypingRelay {
    private static final Logger log = LoggerFactory.getLogger(TypingRelay.class);

    private final RoomRouter router;

    public TypingRelay(RoomRouter router) {
        this.router = router;
    }

    /**
     * @return whether the signal was relayed
     */
    public boolean relay(Session session, String connectionId, TypingRequest request, boolean typing) {
        if (session == null || request == null || request.userId == null
                || !session.userId().equalsIgnoreCase(request.userId)) {
            log.debug("[TYPING-DROP] conn={} reason=auth", connectionId);
            return false;
        }
        try {
            ConversationTarget target = ConversationTarget.resolve(request.dialogId, request.groupId);
            String event = typing ? EventNames.USER_TYPING : EventNames.USER_STOPPED_TYPING;
            router.broadcastExcept(router.roomFor(target), event,
                    new TypingSignal(target.dialogId(), target.groupId(), session.userId()), connectionId);
            return true;
        } catch (RealtimeException e) {
            log.debug("[TYPING-DROP] conn={} user={} reason={}", connectionId, session.userId(), e.code());
            return false;
        } catch (RuntimeException e) {
            log.warn("[TYPING-DROP] conn={} user={} err={}", connectionId, session.userId(), e.toString());
            return false;
        }
    }
}
