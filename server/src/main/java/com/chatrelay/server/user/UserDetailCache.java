package com.chatrelay.server.user;

import com.chatrelay.server.error.ErrorCode;
import com.chatrelay.server.error.RealtimeException;
import com.chatrelay.server.model.UserDetails;
import com.chatrelay.server.store.UserDirectory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Read-through cache of username and avatar. Entries expire {@code ttl} after they
 * were fetched and are never invalidated earlier, so a rename or new avatar can show
 * up late by at most one TTL. Missing users are not cached.
 */
@Component
public class UserDetailCache {
    private static final Logger log = LoggerFactory.getLogger(UserDetailCache.class);

    private final UserDirectory directory;
    private final Clock clock;
    private final Cache<String, CachedUserDetail> entries;

    public UserDetailCache(UserDirectory directory, Clock clock,
                           @Value("${realtime.user-cache.ttl-ms:300000}") long ttlMs,
                           @Value("${realtime.user-cache.maximum-size:10000}") long maximumSize) {
        this.directory = directory;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(Duration.ofMillis(ttlMs))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * @throws RealtimeException {@code USER_NOT_FOUND} when the directory has no such user
     */
    public UserDetails getDetails(String userId) {
        CachedUserDetail cached = entries.getIfPresent(userId);
        if (cached != null) {
            return cached.details();
        }
        // the directory call runs outside any cache lock; two misses may both fetch
        UserDetails fresh = directory.findUserDetails(userId)
                .orElseThrow(() -> new RealtimeException(ErrorCode.USER_NOT_FOUND, "User not found"));
        entries.put(userId, new CachedUserDetail(userId, fresh, clock.instant()));
        log.debug("[CACHE-FILL] user={}", userId);
        return fresh;
    }
}
