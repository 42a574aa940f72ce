package com.chatrelay.server.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MarkReadRequest {
    @JsonProperty("dialog_id")
    public String dialogId;

    @JsonProperty("group_id")
    public String groupId;

    @JsonProperty("message_ids")
    public List<String> messageIds;
}
