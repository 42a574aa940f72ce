package com.chatrelay.server.model;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;

/**
 * Exactly one of a dialog or a group.
 */
public record ConversationTarget(ConversationKind kind, String id) {

    /**
     * Picks the single target out of a {@code dialog_id}/{@code group_id} pair. Only
     * presence is checked here; id format is checked separately.
     */
    public static ConversationTarget resolve(String dialogId, String groupId) {
        boolean hasDialog = dialogId != null && !dialogId.isEmpty();
        boolean hasGroup = groupId != null && !groupId.isEmpty();
        if (!hasDialog && !hasGroup) {
            throw new RealtimeException(ErrorCode.MISSING_ID, "Either dialog_id or group_id must be provided");
        }
        if (hasDialog && hasGroup) {
            throw new RealtimeException(ErrorCode.INVALID_INPUT, "Provide either dialog_id or group_id, not both");
        }
        return hasDialog
                ? new ConversationTarget(ConversationKind.DIALOG, dialogId)
                : new ConversationTarget(ConversationKind.GROUP, groupId);
    }

    public static ConversationTarget dialog(String id) {
        return new ConversationTarget(ConversationKind.DIALOG, id);
    }

    public static ConversationTarget group(String id) {
        return new ConversationTarget(ConversationKind.GROUP, id);
    }

    public String dialogId() {
        return kind == ConversationKind.DIALOG ? id : null;
    }

    public String groupId() {
        return kind == ConversationKind.GROUP ? id : null;
    }

    @Override
    public String toString() {
        return kind.label() + ":" + id;
    }
}
