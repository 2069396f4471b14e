package com.abba.answerdesk.infrastructure.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ConnectorConfig {

    @Bean
    public OkHttpClient connectorHttpClient(ConnectorProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getTimeout())
                .readTimeout(properties.getTimeout())
                .writeTimeout(properties.getTimeout())
                .callTimeout(properties.getTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
