package com.chatrelay.server.model;

public record UserDetails(String username, String avatarPath) {
}
