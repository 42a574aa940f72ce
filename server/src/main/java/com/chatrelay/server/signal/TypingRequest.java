package com.chatrelay.server.signal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TypingRequest {
    @JsonProperty("dialog_id")
    public String dialogId;

    @JsonProperty("group_id")
    public String groupId;

    @JsonProperty("user_id")
    public String userId;
}
