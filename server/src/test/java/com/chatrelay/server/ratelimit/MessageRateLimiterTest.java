package com.chatrelay.server.ratelimit;

import com.chatrelay.server.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.chatrelay.server.support.Ids.ALICE;
import static com.chatrelay.server.support.Ids.BOB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MessageRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final MessageRateLimiter limiter = new MessageRateLimiter(10, 60_000, clock);

    @Test
    public void shouldAllowExactlyLimitWithinWindow() {
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.checkAndConsume(ALICE), "send " + i);
            clock.advanceMillis(100);
        }
        assertFalse(limiter.checkAndConsume(ALICE));
        assertEquals(10, limiter.recordedSends(ALICE));
    }

    @Test
    public void shouldRecoverAfterWindowPasses() {
        for (int i = 0; i < 10; i++) {
            limiter.checkAndConsume(ALICE);
        }
        assertFalse(limiter.checkAndConsume(ALICE));

        clock.advanceMillis(60_001);
        assertTrue(limiter.checkAndConsume(ALICE));
        assertEquals(1, limiter.recordedSends(ALICE));
    }

    @Test
    public void shouldSlideRatherThanReset() {
        for (int i = 0; i < 5; i++) {
            limiter.checkAndConsume(ALICE);
        }
        clock.advanceMillis(30_000);
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.checkAndConsume(ALICE));
        }
        assertFalse(limiter.checkAndConsume(ALICE));

        // the first five age out, the last five stay
        clock.advanceMillis(30_000);
        assertEquals(5, countAllowed(10));
    }

    @Test
    public void shouldNotRecordRejectedAttempts() {
        for (int i = 0; i < 25; i++) {
            limiter.checkAndConsume(ALICE);
        }
        assertEquals(10, limiter.recordedSends(ALICE));
    }

    @Test
    public void shouldTrackUsersIndependently() {
        for (int i = 0; i < 10; i++) {
            limiter.checkAndConsume(ALICE);
        }
        assertFalse(limiter.checkAndConsume(ALICE));
        assertTrue(limiter.checkAndConsume(BOB));
    }

    @Test
    public void shouldForgetIdleUsers() {
        limiter.checkAndConsume(ALICE);
        limiter.checkAndConsume(BOB);
        assertEquals(2, limiter.trackedUsers());

        clock.advanceMillis(30_000);
        limiter.checkAndConsume(BOB);
        clock.advanceMillis(30_000);
        assertEquals(1, limiter.trackedUsers());
        assertEquals(0, limiter.recordedSends(ALICE));

        clock.advanceMillis(60_000);
        assertEquals(0, limiter.trackedUsers());
        assertTrue(limiter.checkAndConsume(ALICE));
    }

    @Test
    public void shouldRejectNonPositiveConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new MessageRateLimiter(0, 1000, clock));
        assertThrows(IllegalArgumentException.class, () -> new MessageRateLimiter(5, 0, clock));
    }

    private int countAllowed(int attempts) {
        int allowed = 0;
        for (int i = 0; i < attempts; i++) {
            if (limiter.checkAndConsume(ALICE)) allowed++;
        }
        return allowed;
    }
}
