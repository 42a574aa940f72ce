package com.chatrelay.server.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundFrame {
    @NotBlank @Size(max = 64)
    public String event;

    public JsonNode data;
}
