package com.abba.answerdesk.application.connector;

import com.abba.answerdesk.domain.exception.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.TimeMeter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

// Once the budget is spent, calls are rejected until window has elapsed since the first rejection.
public class RateLimiter {

    private final String platform;
    private final long requestsPerWindow;
    private final Duration window;
    private final Clock clock;

    private Bucket bucket;
    private Instant blockedUntil;

    public RateLimiter(String platform, long requestsPerWindow, Duration window, Clock clock) {
        if (requestsPerWindow < 1) {
            throw new IllegalArgumentException("requestsPerWindow must be positive for " + platform);
        }
        this.platform = platform;
        this.requestsPerWindow = requestsPerWindow;
        this.window = window;
        this.clock = clock;
        this.bucket = newBucket();
    }

    public synchronized void acquire() {
        Instant now = clock.instant();
        if (blockedUntil != null) {
            if (now.isBefore(blockedUntil)) {
                throw new RateLimitExceededException(platform, blockedUntil);
            }
            blockedUntil = null;
            bucket = newBucket();
        }
        if (!bucket.tryConsume(1)) {
            blockedUntil = now.plus(window);
            throw new RateLimitExceededException(platform, blockedUntil);
        }
    }

    public synchronized long availableRequests() {
        if (blockedUntil != null && clock.instant().isBefore(blockedUntil)) {
            return 0;
        }
        return blockedUntil != null ? requestsPerWindow : bucket.getAvailableTokens();
    }

    private Bucket newBucket() {
        Bandwidth limit = Bandwidth.builder()
                .capacity(requestsPerWindow)
                .refillIntervally(requestsPerWindow, window)
                .build();
        return Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(new ClockTimeMeter(clock))
                .build();
    }

    private record ClockTimeMeter(Clock clock) implements TimeMeter {

        @Override
        public long currentTimeNanos() {
            return Duration.ofMillis(clock.millis()).toNanos();
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
