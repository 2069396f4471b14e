package com.abba.answerdesk.application.connector;

import com.abba.answerdesk.domain.exception.AuthenticationException;
import com.abba.answerdesk.domain.exception.ConnectorException;
import com.abba.answerdesk.domain.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

@Slf4j
public class ConnectorState {

    private final String platform;
    private final RateLimiter rateLimiter;
    private final AtomicLong requestCount = new AtomicLong();

    private volatile boolean connected;
    private volatile String permanentFailure;
    private volatile String lastError;

    public ConnectorState(String platform, RateLimiter rateLimiter) {
        this.platform = platform;
        this.rateLimiter = rateLimiter;
    }

    public synchronized boolean connect(Runnable handshake) {
        if (connected) {
            return true;
        }
        if (permanentFailure != null) {
            log.debug("Not reconnecting {}: {}", platform, permanentFailure);
            return false;
        }
        try {
            handshake.run();
            connected = true;
            lastError = null;
            return true;
        } catch (AuthenticationException e) {
            markPermanentFailure(e.getMessage());
            return false;
        } catch (ConnectorException e) {
            recordError(e.getMessage());
            return false;
        }
    }

    public <T> T call(String operation, Supplier<T> call, T unavailable) {
        if (!connected) {
            return unavailable;
        }
        try {
            rateLimiter.acquire();
        } catch (RateLimitExceededException e) {
            recordError(e.getMessage());
            log.debug("{} {} short-circuited: {}", platform, operation, e.getMessage());
            return unavailable;
        }
        requestCount.incrementAndGet();
        try {
            return call.get();
        } catch (AuthenticationException e) {
            markPermanentFailure(e.getMessage());
            return unavailable;
        } catch (ConnectorException e) {
            recordError(e.getMessage());
            log.warn("{} {} failed: {}", platform, operation, e.getMessage());
            return unavailable;
        }
    }

    public void markPermanentFailure(String reason) {
        connected = false;
        permanentFailure = reason;
        lastError = reason;
        log.error("{} credentials rejected, connector disabled: {}", platform, reason);
    }

    public void recordError(String error) {
        lastError = error;
    }

    public boolean isConnected() {
        return connected;
    }

    public boolean isPermanentlyFailed() {
        return permanentFailure != null;
    }

    public String getLastError() {
        return lastError;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public String getPlatform() {
        return platform;
    }
}
