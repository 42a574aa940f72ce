package com.chatrelay.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A stored message joined with everything a client needs to render it: sender
 * avatar, reply preview, attachments and read receipts. This is the
 * {@code newMessage} payload.
 */
public record HydratedMessage(
        @JsonProperty("id") String id,
        @JsonProperty("dialog_id") String dialogId,
        @JsonProperty("group_id") String groupId,
        @JsonProperty("sender_id") String senderId,
        @JsonProperty("sender_username") String senderUsername,
        @JsonProperty("sender_avatar_url") String senderAvatarUrl,
        @JsonProperty("content") String content,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("is_edited") boolean edited,
        @JsonProperty("is_forwarded") boolean forwarded,
        @JsonProperty("forwarded_from_username") String forwardedFromUsername,
        @JsonProperty("replied_to_message_id") String repliedToMessageId,
        @JsonProperty("replied_to_sender_username") String repliedToSenderUsername,
        @JsonProperty("replied_to_content") String repliedToContent,
        @JsonProperty("files") List<FileAttachment> files,
        @JsonProperty("read_by_users") List<ReadReceipt> readByUsers) {

    public ConversationTarget target() {
        return dialogId != null ? ConversationTarget.dialog(dialogId) : ConversationTarget.group(groupId);
    }
}
