package com.chatrelay.server.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SendMessageRequest {
    @JsonProperty("dialog_id")
    public String dialogId;

    @JsonProperty("group_id")
    public String groupId;

    @JsonProperty("sender_id")
    public String senderId;

    public String content;

    public List<String> mentions;

    public List<String> fileIds;

    @JsonProperty("replied_to_message_id")
    public String repliedToMessageId;
}
