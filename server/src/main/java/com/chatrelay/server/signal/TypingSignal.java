package com.chatrelay.server.signal;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TypingSignal(
        @JsonProperty("dialog_id") String dialogId,
        @JsonProperty("group_id") String groupId,
        @JsonProperty("user_id") String userId) {
}
