package com.chatrelay.server.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window limit on message sends per user. Each user's window is pruned and
 * updated inside a single {@code compute}, so concurrent sends from several devices
 * of the same user cannot both slip past the limit. A window untouched for a full
 * {@code windowMs} holds nothing but expired sends and is evicted.
 */
@Component
public class MessageRateLimiter {

    private final Cache<String, Deque<Long>> windows;
    private final int maxMessages;
    private final long windowMs;
    private final Clock clock;

    public MessageRateLimiter(@Value("${realtime.rate-limit.max-messages:10}") int maxMessages,
                              @Value("${realtime.rate-limit.window-ms:60000}") long windowMs,
                              Clock clock) {
        if (maxMessages <= 0 || windowMs <= 0) {
            throw new IllegalArgumentException("rate limit must be positive: " + maxMessages + "/" + windowMs + "ms");
        }
        this.maxMessages = maxMessages;
        this.windowMs = windowMs;
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMillis(windowMs))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * Records a send for the user if the window has room.
     *
     * @return false when the user already sent {@code maxMessages} within the window;
     *         a rejected attempt is not recorded
     */
    public boolean checkAndConsume(String userId) {
        long now = clock.millis();
        boolean[] allowed = new boolean[1];
        windows.asMap().compute(userId, (id, window) -> {
            Deque<Long> w = window != null ? window : new ArrayDeque<>();
            while (!w.isEmpty() && now - w.peekFirst() >= windowMs) {
                w.pollFirst();
            }
            if (w.size() >= maxMessages) {
                allowed[0] = false;
                return w;
            }
            w.addLast(now);
            allowed[0] = true;
            return w;
        });
        return allowed[0];
    }

    int recordedSends(String userId) {
        Deque<Long> w = windows.getIfPresent(userId);
        return w == null ? 0 : w.size();
    }

    long trackedUsers() {
        windows.cleanUp();
        return windows.estimatedSize();
    }
}
