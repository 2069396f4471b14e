package com.abba.answerdesk.domain.exception;

import lombok.Getter;

import java.time.Instant;

@Getter
public class RateLimitExceededException extends ConnectorException {

    private final Instant retryAt;

    public RateLimitExceededException(String platform, Instant retryAt) {
        super(platform, "Request budget exhausted for " + platform + " until " + retryAt);
        this.retryAt = retryAt;
    }
}
