package com.chatrelay.server.model;

public record StoredMessage(
        String id,
        ConversationTarget target,
        String senderId,
        String senderUsername,
        String content) {
}
