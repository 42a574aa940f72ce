package com.chatrelay.server.model;

public record EventSummary(String id, String creatorId) {
}
