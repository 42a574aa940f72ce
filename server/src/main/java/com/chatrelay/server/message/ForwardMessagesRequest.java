package com.chatrelay.server.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ForwardMessagesRequest {
    @JsonProperty("message_ids")
    public List<String> messageIds;

    public List<Target> targets;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Target {
        @JsonProperty("dialog_id")
        public String dialogId;

        @JsonProperty("group_id")
        public String groupId;

        public Target() {
        }

        public Target(String dialogId, String groupId) {
            this.dialogId = dialogId;
            this.groupId = groupId;
        }
    }
}
