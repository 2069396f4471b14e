package com.abba.answerdesk.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "answerdesk")
@Data
public class AnswerDeskProperties {

    private String mode = "local";

    public boolean isLocalMode() {
        return "local".equalsIgnoreCase(mode);
    }
}
