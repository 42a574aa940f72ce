package com.chatrelay.server.message;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Payloads emitted by the message pipeline. */
public final class MessageEvents {

    private MessageEvents() {
    }

    public record Notification(
            @JsonProperty("type") String type,
            @JsonProperty("content") String content,
            @JsonProperty("related_dialog_id") String relatedDialogId,
            @JsonProperty("related_group_id") String relatedGroupId,
            @JsonProperty("related_message_id") String relatedMessageId) {
    }

    public record MessageReadUpdate(
            @JsonProperty("dialog_id") String dialogId,
            @JsonProperty("group_id") String groupId,
            @JsonProperty("message_id") String messageId,
            @JsonProperty("user_id") String userId,
            @JsonProperty("username") String username,
            @JsonProperty("avatarUrl") String avatarUrl,
            @JsonProperty("read_at") String readAt) {
    }

    public record MessagesRead(
            @JsonProperty("dialog_id") String dialogId,
            @JsonProperty("group_id") String groupId,
            @JsonProperty("user_id") String userId,
            @JsonProperty("avatarUrl") String avatarUrl,
            @JsonProperty("message_ids") List<String> messageIds,
            @JsonProperty("read_at") String readAt) {
    }

    public record MessageEdited(
            @JsonProperty("message_id") String messageId,
            @JsonProperty("dialog_id") String dialogId,
            @JsonProperty("group_id") String groupId,
            @JsonProperty("sender_id") String senderId,
            @JsonProperty("content") String content,
            @JsonProperty("sender_username") String senderUsername,
            @JsonProperty("avatarUrl") String avatarUrl,
            @JsonProperty("updated_at") String updatedAt) {
    }

    public record MessageDeleted(
            @JsonProperty("message_id") String messageId,
            @JsonProperty("dialog_id") String dialogId,
            @JsonProperty("group_id") String groupId) {
    }

    public record ForwardedBatch(
            @JsonProperty("dialog_id") String dialogId,
            @JsonProperty("group_id") String groupId,
            @JsonProperty("message_ids") List<String> messageIds) {
    }

    public record ForwardFailure(
            @JsonProperty("message_id") String messageId,
            @JsonProperty("dialog_id") String dialogId,
            @JsonProperty("group_id") String groupId,
            @JsonProperty("errorCode") String errorCode) {
    }

    public record MessagesForwarded(
            @JsonProperty("results") List<ForwardedBatch> results,
            @JsonProperty("failures") List<ForwardFailure> failures) {
    }
}
