package com.abba.answerdesk.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "answerdesk.platforms")
@Data
public class PlatformProperties {

    private List<String> enabled = new ArrayList<>(List.of("linkedin", "gmail", "telegram", "facebook", "instagram"));
    private int defaultRequestsPerMinute = 30;

    private Telegram telegram = new Telegram();
    private Gmail gmail = new Gmail();
    private Meta facebook = new Meta();
    private Meta instagram = new Meta();
    private LinkedIn linkedin = new LinkedIn();

    @Data
    public static class Telegram {
        private String apiBaseUrl = "https://api.telegram.org";
        private String botToken;
        private Integer requestsPerMinute = 30;
    }

    @Data
    public static class Gmail {
        private String apiBaseUrl = "https://gmail.googleapis.com/gmail/v1";
        private String accessToken;
        private String query = "is:unread in:inbox";
        private int maxResults = 10;
        private Integer requestsPerMinute = 60;
    }

    @Data
    public static class Meta {
        private String apiBaseUrl = "https://graph.facebook.com/v19.0";
        private String accessToken;
        private String pageId = "me";
        private Integer requestsPerMinute = 20;
    }

    @Data
    public static class LinkedIn {
        private String apiBaseUrl = "https://api.linkedin.com";
        private String accessToken;
        private String apiVersion = "202401";
        private Integer requestsPerMinute = 10;
    }
}
