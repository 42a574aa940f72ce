package com.chatrelay.server.model;

public record EditedMessage(
        String id,
        ConversationTarget target,
        String senderId,
        String content,
        String updatedAt) {
}
