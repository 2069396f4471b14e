package com.abba.answerdesk.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "answerdesk.connectors")
@Data
public class ConnectorProperties {

    private Duration timeout = Duration.ofSeconds(10);
    private int retryAttempts = 3;
    private Duration retryBaseDelay = Duration.ofSeconds(1);
    private Duration rateLimitWindow = Duration.ofSeconds(60);
    private Duration simulatedConnectLatency = Duration.ofSeconds(1);
    private Duration simulatedSendLatency = Duration.ofMillis(500);
}
