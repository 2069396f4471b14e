package com.abba.answerdesk.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "answerdesk.operator")
@Data
public class OperatorProperties {

    private int previewLength = 100;
    private Telegram telegram = new Telegram();

    @Data
    public static class Telegram {
        private boolean enabled;
        private String apiBaseUrl = "https://api.telegram.org";
        private String botToken;
        private String chatId;
        private String webhookSecret;
    }
}
