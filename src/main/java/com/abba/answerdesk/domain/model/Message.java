package com.abba.answerdesk.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.OffsetDateTime;

@Document(collection = "messages")
@CompoundIndex(name = "platform_external_idx", def = "{'platform': 1, 'externalId': 1}")
@Data
public class Message {

    @Id
    private String id;
    private String platform;
    private String externalId;
    private String sender;
    private String replyTo;
    private String content;
    @Indexed
    private OffsetDateTime receivedAt = OffsetDateTime.now();
    @Indexed
    private MessageStatus status = MessageStatus.PENDING;
    private MessageCategory category = MessageCategory.GENERAL;
    private boolean answered;
    private boolean ignored;

    public boolean markAsProcessing() {
        return moveTo(MessageStatus.PROCESSING);
    }

    public boolean markAsAnswered() {
        if (!moveTo(MessageStatus.ANSWERED)) {
            return false;
        }
        this.answered = true;
        return true;
    }

    public boolean markAsIgnored() {
        if (!moveTo(MessageStatus.IGNORED)) {
            return false;
        }
        this.ignored = true;
        return true;
    }

    private boolean moveTo(MessageStatus next) {
        if (status == null || !status.canTransitionTo(next)) {
            return false;
        }
        this.status = next;
        return true;
    }
}
