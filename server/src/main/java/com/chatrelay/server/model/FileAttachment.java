package com.chatrelay.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FileAttachment(
        @JsonProperty("id") String id,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("file_type") String fileType,
        @JsonProperty("file_size") Long fileSize) {
}
