package com.chatrelay.server.ws;

public record FailurePayload(String errorCode, String message) {
}
