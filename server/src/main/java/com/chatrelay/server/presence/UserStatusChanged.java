package com.chatrelay.server.presence;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserStatusChanged(String userId, @JsonProperty("isOnline") boolean isOnline,
                                String username, String avatarUrl) {
}
