package com.chatrelay.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReadReceipt(
        @JsonProperty("contact_id") String userId,
        @JsonProperty("username") String username,
        @JsonProperty("read_at") String readAt) {
}
