package com.chatrelay.server.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DeleteMessageRequest {
    @JsonProperty("message_id")
    public String messageId;
}
