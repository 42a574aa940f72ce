package com.chatrelay.server.ws;

public record OutboundFrame(String event, Object data) {
}
