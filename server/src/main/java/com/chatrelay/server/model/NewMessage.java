package com.chatrelay.server.model;

import java.util.List;

/** Validated input of a send, handed to the store as one atomic write. */
public record NewMessage(
        ConversationTarget target,
        String senderId,
        String content,
        List<String> mentions,
        List<String> fileIds,
        String repliedToMessageId) {
}
