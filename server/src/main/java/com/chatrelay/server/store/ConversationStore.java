package com.chatrelay.server.store;

import com.chatrelay.server.model.ConversationTarget;
import com.chatrelay.server.model.EditedMessage;
import com.chatrelay.server.model.HydratedMessage;
import com.chatrelay.server.model.NewMessage;
import com.chatrelay.server.model.StoredMessage;

import java.util.List;
import java.util.Optional;

/**
 * Dialogs, groups and their messages. Implementations throw
 * {@link com.chatrelay.server.error.StoreException} on I/O failure.
 */
public interface ConversationStore {

    boolean isParticipant(String userId, ConversationTarget target);

    List<String> findParticipantIds(ConversationTarget target);

    boolean messageExistsIn(String messageId, ConversationTarget target);

    /**
     * Inserts the row, links the files and records the sender's own read mark as one
     * unit, then returns the message hydrated for broadcast.
     */
    HydratedMessage createMessage(NewMessage message);

    Optional<StoredMessage> findMessage(String messageId);

    EditedMessage updateMessageContent(String messageId, String content);

    void deleteMessage(String messageId);

    /**
     * Records read marks for the given messages that belong to {@code target}.
     * Already-read messages are left untouched.
     *
     * @return the ids that belong to the conversation, in request order
     */
    List<String> markRead(String userId, ConversationTarget target, List<String> messageIds);

    /** Copies {@code source} into {@code target} as a forwarded message sent by {@code senderId}. */
    HydratedMessage forwardMessage(StoredMessage source, ConversationTarget target, String senderId);
}
