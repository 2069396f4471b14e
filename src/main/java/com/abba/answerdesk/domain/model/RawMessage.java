package com.abba.answerdesk.domain.model;

import java.time.OffsetDateTime;

public record RawMessage(
        String platform,
        String externalId,
        String sender,
        String replyTo,
        String content,
        OffsetDateTime timestamp
) {

    public RawMessage withPlatform(String platformKey) {
        return new RawMessage(platformKey, externalId, sender, replyTo, content, timestamp);
    }
}
