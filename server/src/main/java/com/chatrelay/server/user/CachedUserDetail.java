package com.chatrelay.server.user;

import com.chatrelay.server.model.UserDetails;

import java.time.Instant;

record CachedUserDetail(String userId, UserDetails details, Instant fetchedAt) {
}
