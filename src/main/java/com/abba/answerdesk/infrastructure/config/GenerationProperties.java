package com.abba.answerdesk.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "answerdesk.generation")
@Data
public class GenerationProperties {

    private int maxTokens = 500;
    private Duration timeout = Duration.ofSeconds(10);
    private String defaultWritingStyle = "professional";
}
