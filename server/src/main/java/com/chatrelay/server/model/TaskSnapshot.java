package com.chatrelay.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The {@code taskStatus} payload. */
public record TaskSnapshot(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("title") String title,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt) {
}
