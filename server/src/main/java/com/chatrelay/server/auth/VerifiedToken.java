package com.chatrelay.server.auth;

public record VerifiedToken(String userId, String username) {
}
