package com.chatrelay.server.message;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.error.StoreException;
import com.chatrelay.server.message.MessageEvents.ForwardFailure;
import com.chatrelay.server.message.MessageEvents.ForwardedBatch;
import com.chatrelay.server.message.MessageEvents.MessageDeleted;
import com.chatrelay.server.message.MessageEvents.MessageEdited;
import com.chatrelay.server.message.MessageEvents.MessageReadUpdate;
import com.chatrelay.server.message.MessageEvents.MessagesForwarded;
import com.chatrelay.server.message.MessageEvents.MessagesRead;
import com.chatrelay.server.message.MessageEvents.Notification;
import com.chatrelay.server.model.ConversationTarget;
import com.chatrelay.server.model.EditedMessage;
import com.chatrelay.server.model.HydratedMessage;
import com.chatrelay.server.model.Identifiers;
import com.chatrelay.server.model.NewMessage;
import com.chatrelay.server.model.StoredMessage;
import com.chatrelay.server.model.UserDetails;
import com.chatrelay.server.ratelimit.MessageRateLimiter;
import com.chatrelay.server.room.RoomName;
import com.chatrelay.server.room.RoomRouter;
import com.chatrelay.server.session.Session;
import com.chatrelay.server.store.ConversationStore;
import com.chatrelay.server.user.UserDetailCache;
import com.chatrelay.server.ws.EventNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validates, persists and fans out chat messages.
 *
 * <p>Every check runs before the first write, in a fixed order, and the first failing
 * check decides the error code. Once the store has accepted a write the operation is
 * reported as successful; failures in the broadcasts that follow are only logged.
 */
@Component
public class MessageFanoutPipeline {
    private static final Logger log = LoggerFactory.getLogger(MessageFanoutPipeline.class);

    static final String TYPE_NEW_MESSAGE = "new_message";
    static final String TYPE_MENTION = "mention";

    private final RoomRouter router;
    private final ConversationStore store;
    private final MessageRateLimiter rateLimiter;
    private final UserDetailCache userDetails;
    private final Clock clock;
    private final int maxContentLength;
    private final int maxForwardPairs;

    public MessageFanoutPipeline(RoomRouter router, ConversationStore store,
                                 MessageRateLimiter rateLimiter, UserDetailCache userDetails, Clock clock,
                                 @Value("${realtime.message.max-content-length:2000}") int maxContentLength,
                                 @Value("${realtime.forward.max-pairs:50}") int maxForwardPairs) {
        this.router = router;
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.userDetails = userDetails;
        this.clock = clock;
        this.maxContentLength = maxContentLength;
        this.maxForwardPairs = maxForwardPairs;
    }

    public HydratedMessage sendMessage(Session session, SendMessageRequest request) {
        if (session == null || request.senderId == null || !session.userId().equalsIgnoreCase(request.senderId)) {
            throw new RealtimeException(ErrorCode.AUTH_MISMATCH, "Authentication mismatch or user not authenticated");
        }
        String userId = session.userId();

        // 1. target
        ConversationTarget target = ConversationTarget.resolve(request.dialogId, request.groupId);

        // 2. something to send
        List<String> mentions = distinct(request.mentions);
        List<String> fileIds = distinct(request.fileIds);
        boolean hasContent = request.content != null && !request.content.isEmpty();
        if (!hasContent && fileIds.isEmpty()) {
            throw new RealtimeException(ErrorCode.EMPTY_MESSAGE, "Message must have content or files");
        }

        // 3. id formats
        if (!Identifiers.isUuid(target.id())) {
            throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid " + target.kind().label() + " ID format");
        }
        if (!Identifiers.allUuids(mentions)) {
            throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid mention ID format");
        }
        if (!Identifiers.allUuids(fileIds)) {
            throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid file ID format");
        }
        String replyId = request.repliedToMessageId;
        if (replyId != null && !Identifiers.isUuid(replyId)) {
            throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid reply message ID format");
        }
        mentions = normalized(mentions);
        fileIds = normalized(fileIds);
        if (replyId != null) replyId = Identifiers.normalize(replyId);

        // 4. length
        if (hasContent && request.content.length() > maxContentLength) {
            throw new RealtimeException(ErrorCode.CONTENT_TOO_LONG,
                    "Message content exceeds " + maxContentLength + " characters");
        }

        // 5. rate
        if (!rateLimiter.checkAndConsume(userId)) {
            throw new RealtimeException(ErrorCode.RATE_LIMIT_EXCEEDED, "Too many messages, slow down");
        }

        // 6. membership, never cached
        router.requireParticipant(userId, target);

        // 7. reply must live in the same conversation
        if (replyId != null && !store.messageExistsIn(replyId, target)) {
            throw new RealtimeException(ErrorCode.INVALID_REPLY_ID, "Replied message not found in this conversation");
        }

        HydratedMessage saved = store.createMessage(new NewMessage(
                target, userId, hasContent ? request.content : "", mentions, fileIds, replyId));
        log.info("[SEND] user={} target={} message={} files={} mentions={}",
                userId, target, saved.id(), fileIds.size(), mentions.size());

        fanOut(saved, target, userId, session.username(), mentions);
        return saved;
    }

    private void fanOut(HydratedMessage saved, ConversationTarget target, String senderId,
                        String senderName, List<String> mentions) {
        RoomName room = router.roomFor(target);
        router.broadcast(room, EventNames.NEW_MESSAGE, saved);
        String displayName = saved.senderUsername() != null ? saved.senderUsername() : senderName;

        try {
            notifyParticipants(saved, target, senderId, displayName);
        } catch (RuntimeException e) {
            log.error("[FANOUT] participant notification failed message={} target={}", saved.id(), target, e);
        }

        for (String mentioned : mentions) {
            if (mentioned.equalsIgnoreCase(senderId)) continue;
            try {
                router.unicast(mentioned, EventNames.NOTIFICATION, new Notification(TYPE_MENTION,
                        "You were mentioned by " + displayName,
                        target.dialogId(), target.groupId(), saved.id()));
            } catch (RuntimeException e) {
                log.warn("[FANOUT] mention notification failed message={} user={} err={}",
                        saved.id(), mentioned, e.toString());
            }
        }

        try {
            UserDetails sender = userDetails.getDetails(senderId);
            router.broadcast(room, EventNames.MESSAGE_READ_UPDATE, new MessageReadUpdate(
                    target.dialogId(), target.groupId(), saved.id(), senderId,
                    sender.username(), sender.avatarPath(), saved.createdAt()));
        } catch (RuntimeException e) {
            log.warn("[FANOUT] read update failed message={} err={}", saved.id(), e.toString());
        }
    }

    private void notifyParticipants(HydratedMessage saved, ConversationTarget target,
                                    String senderId, String displayName) {
        Notification notification = new Notification(TYPE_NEW_MESSAGE, "New message from " + displayName,
                target.dialogId(), target.groupId(), saved.id());
        for (String participant : store.findParticipantIds(target)) {
            if (participant.equalsIgnoreCase(senderId)) continue;
            router.unicast(participant, EventNames.NOTIFICATION, notification);
        }
    }

    public EditedMessage editMessage(Session session, EditMessageRequest request) {
        String userId = requireSession(session);
        if (!Identifiers.isUuid(request.messageId)) {
            throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid message ID format");
        }
        if (request.content == null || request.content.isEmpty() || request.content.length() > maxContentLength) {
            throw new RealtimeException(ErrorCode.INVALID_CONTENT,
                    "Content must be between 1 and " + maxContentLength + " characters");
        }
        StoredMessage message = requireOwnMessage(userId, request.messageId);
        UserDetails sender = userDetails.getDetails(userId);

        EditedMessage edited = store.updateMessageContent(message.id(), request.content);
        log.info("[EDIT] user={} message={} target={}", userId, edited.id(), edited.target());
        router.broadcast(router.roomFor(edited.target()), EventNames.MESSAGE_EDITED, new MessageEdited(
                edited.id(), edited.target().dialogId(), edited.target().groupId(), edited.senderId(),
                edited.content(), sender.username(), sender.avatarPath(), edited.updatedAt()));
        return edited;
    }

    public StoredMessage deleteMessage(Session session, DeleteMessageRequest request) {
        String userId = requireSession(session);
        if (!Identifiers.isUuid(request.messageId)) {
            throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid message ID format");
        }
        StoredMessage message = requireOwnMessage(userId, request.messageId);

        store.deleteMessage(message.id());
        log.info("[DELETE] user={} message={} target={}", userId, message.id(), message.target());
        router.broadcast(router.roomFor(message.target()), EventNames.MESSAGE_DELETED, new MessageDeleted(
                message.id(), message.target().dialogId(), message.target().groupId()));
        return message;
    }

    public List<String> markMessagesAsRead(Session session, MarkReadRequest request) {
        String userId = requireSession(session);
        ConversationTarget target = ConversationTarget.resolve(request.dialogId, request.groupId);
        List<String> messageIds = distinct(request.messageIds);
        if (messageIds.isEmpty()) {
            throw new RealtimeException(ErrorCode.INVALID_INPUT, "No message IDs provided");
        }
        if (!Identifiers.isUuid(target.id())) {
            throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid " + target.kind().label() + " ID format");
        }
        if (!Identifiers.allUuids(messageIds)) {
            throw new RealtimeException(ErrorCode.INVALID_MESSAGE_IDS, "Invalid message IDs provided");
        }
        router.requireParticipant(userId, target);

        List<String> marked = store.markRead(userId, target, messageIds);
        String readAt = clock.instant().toString();
        log.info("[READ] user={} target={} requested={} marked={}", userId, target, messageIds.size(), marked.size());
        if (marked.isEmpty()) return marked;

        try {
            UserDetails reader = userDetails.getDetails(userId);
            router.broadcast(router.roomFor(target), EventNames.MESSAGES_READ, new MessagesRead(
                    target.dialogId(), target.groupId(), userId, reader.avatarPath(), marked, readAt));
        } catch (RuntimeException e) {
            log.warn("[READ] broadcast failed user={} target={} err={}", userId, target, e.toString());
        }
        return marked;
    }

    /**
     * Copies each source message into each target. Validation and authorization cover
     * the whole request up front; after that every (message, target) pair is created on
     * its own and a failing pair is reported without undoing the others.
     */
    public MessagesForwarded forwardMessages(Session session, ForwardMessagesRequest request) {
        String userId = requireSession(session);
        List<String> messageIds = distinct(request.messageIds);
        if (messageIds.isEmpty() || request.targets == null || request.targets.isEmpty()) {
            throw new RealtimeException(ErrorCode.INVALID_INPUT, "message_ids and targets are required");
        }
        if (!Identifiers.allUuids(messageIds)) {
            throw new RealtimeException(ErrorCode.INVALID_MESSAGE_IDS, "Invalid message IDs provided");
        }
        LinkedHashSet<ConversationTarget> targets = new LinkedHashSet<>();
        for (ForwardMessagesRequest.Target t : request.targets) {
            if (t == null) {
                throw new RealtimeException(ErrorCode.INVALID_INPUT, "Empty forward target");
            }
            ConversationTarget target = ConversationTarget.resolve(t.dialogId, t.groupId);
            if (!Identifiers.isUuid(target.id())) {
                throw new RealtimeException(ErrorCode.INVALID_ID, "Invalid " + target.kind().label() + " ID format");
            }
            targets.add(new ConversationTarget(target.kind(), Identifiers.normalize(target.id())));
        }
        if ((long) messageIds.size() * targets.size() > maxForwardPairs) {
            throw new RealtimeException(ErrorCode.INVALID_INPUT,
                    "Cannot forward more than " + maxForwardPairs + " message copies at once");
        }
        if (!rateLimiter.checkAndConsume(userId)) {
            throw new RealtimeException(ErrorCode.RATE_LIMIT_EXCEEDED, "Too many messages, slow down");
        }
        for (ConversationTarget target : targets) {
            router.requireParticipant(userId, target);
        }

        Map<ConversationTarget, Boolean> readable = new HashMap<>();
        List<StoredMessage> sources = new ArrayList<>();
        for (String id : messageIds) {
            StoredMessage source = store.findMessage(id)
                    .orElseThrow(() -> new RealtimeException(ErrorCode.MESSAGE_NOT_FOUND, "Message not found"));
            boolean canRead = readable.computeIfAbsent(source.target(), t -> store.isParticipant(userId, t));
            if (!canRead) {
                throw new RealtimeException(ErrorCode.ACCESS_DENIED, "You cannot read one of the forwarded messages");
            }
            sources.add(source);
        }

        List<ForwardedBatch> results = new ArrayList<>();
        List<ForwardFailure> failures = new ArrayList<>();
        for (ConversationTarget target : targets) {
            RoomName room = router.roomFor(target);
            List<String> created = new ArrayList<>();
            for (StoredMessage source : sources) {
                HydratedMessage copy;
                try {
                    copy = store.forwardMessage(source, target, userId);
                } catch (StoreException e) {
                    log.error("[FORWARD] copy failed source={} target={}", source.id(), target, e);
                    failures.add(new ForwardFailure(source.id(), target.dialogId(), target.groupId(),
                            ErrorCode.DB_ERROR.name()));
                    continue;
                } catch (RealtimeException e) {
                    log.warn("[FORWARD] copy rejected source={} target={} code={}", source.id(), target, e.code());
                    failures.add(new ForwardFailure(source.id(), target.dialogId(), target.groupId(), e.code().name()));
                    continue;
                }
                created.add(copy.id());

                // the copy exists from here on; delivery problems are only logged
                try {
                    router.broadcast(room, EventNames.NEW_MESSAGE, copy);
                    notifyParticipants(copy, target, userId,
                            copy.senderUsername() != null ? copy.senderUsername() : session.username());
                } catch (RuntimeException e) {
                    log.error("[FORWARD] fan-out failed copy={} target={}", copy.id(), target, e);
                }
            }
            if (!created.isEmpty()) {
                results.add(new ForwardedBatch(target.dialogId(), target.groupId(), created));
            }
        }
        log.info("[FORWARD] user={} sources={} targets={} failures={}",
                userId, sources.size(), targets.size(), failures.size());
        return new MessagesForwarded(results, failures);
    }

    private StoredMessage requireOwnMessage(String userId, String messageId) {
        StoredMessage message = store.findMessage(messageId)
                .orElseThrow(() -> new RealtimeException(ErrorCode.MESSAGE_NOT_FOUND, "Message not found"));
        if (!message.senderId().equalsIgnoreCase(userId)) {
            throw new RealtimeException(ErrorCode.PERMISSION_DENIED, "You can only modify your own messages");
        }
        return message;
    }

    private static String requireSession(Session session) {
        if (session == null) {
            throw new RealtimeException(ErrorCode.UNAUTHENTICATED, "Socket not authenticated");
        }
        return session.userId();
    }

    private static List<String> normalized(List<String> ids) {
        return distinct(ids.stream().map(Identifiers::normalize).collect(Collectors.toList()));
    }

    private static List<String> distinct(List<String> values) {
        if (values == null) return List.of();
        return new ArrayList<>(new LinkedHashSet<>(values));
    }
}
