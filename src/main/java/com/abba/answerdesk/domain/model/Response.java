package com.abba.answerdesk.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.OffsetDateTime;

@Document(collection = "responses")
@Data
public class Response {

    @Id
    private String id;
    @Indexed
    private String messageId;
    private String content;
    private ResponseType type = ResponseType.GENERATED;
    private OffsetDateTime generatedAt = OffsetDateTime.now();
    private boolean sent;
    private OffsetDateTime sentAt;

    public static Response of(String messageId, String content, ResponseType type) {
        Response response = new Response();
        response.setMessageId(messageId);
        response.setContent(content);
        response.setType(type);
        return response;
    }

    public boolean markAsSent(OffsetDateTime when) {
        if (sent) {
            return false;
        }
        this.sent = true;
        this.sentAt = when;
        return true;
    }
}
