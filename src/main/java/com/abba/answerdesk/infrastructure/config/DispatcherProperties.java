package com.abba.answerdesk.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "answerdesk.dispatcher")
@Data
public class DispatcherProperties {

    private boolean enabled = true;
    private Duration interval = Duration.ofSeconds(30);
    private Duration errorBackoff = Duration.ofSeconds(60);
}
