package com.abba.answerdesk.application.connector;

import com.abba.answerdesk.domain.model.Platform;
import com.abba.answerdesk.domain.service.PlatformConnector;
import com.abba.answerdesk.infrastructure.config.ConnectorProperties;
import com.abba.answerdesk.infrastructure.config.PlatformProperties;
import com.abba.answerdesk.infrastructure.gmail.GmailConnector;
import com.abba.answerdesk.infrastructure.http.ConnectorHttpClient;
import com.abba.answerdesk.infrastructure.linkedin.LinkedInConnector;
import com.abba.answerdesk.infrastructure.meta.MetaGraphConnector;
import com.abba.answerdesk.infrastructure.simulation.SimulatedConnector;
import com.abba.answerdesk.infrastructure.simulation.SimulationProfile;
import com.abba.answerdesk.infrastructure.telegram.TelegramConnector;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Random;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectorFactory {

    private final PlatformProperties platformProperties;
    private final ConnectorProperties connectorProperties;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Random random = new Random();

    public ConnectorSelection select(Platform platform) {
        ConnectorCreation creation = createReal(platform);
        String reason = creation.failureReason();
        if (creation.isCreated()) {
            PlatformConnector real = creation.connector();
            try {
                if (real.connect()) {
                    log.info("Using real connector for {}", platform.key());
                    return new ConnectorSelection(platform.key(), real, ConnectorVariant.REAL, null);
                }
                reason = "connect failed: " + real.lastError();
            } catch (RuntimeException e) {
                reason = "connect raised: " + e.getMessage();
            }
        }
        log.warn("Substituting simulated connector for {}: {}", platform.key(), reason);
        return new ConnectorSelection(platform.key(), createSimulated(platform), ConnectorVariant.SIMULATED, reason);
    }

    public ConnectorCreation createReal(Platform platform) {
        ConnectorState state = newState(platform);
        ConnectorHttpClient http = new ConnectorHttpClient(platform.key(), okHttpClient, objectMapper, connectorProperties);
        try {
            return switch (platform) {
                case TELEGRAM -> TelegramConnector.create(platformProperties.getTelegram(), http, state);
                case GMAIL -> GmailConnector.create(platformProperties.getGmail(), http, state);
                case FACEBOOK -> MetaGraphConnector.create(platform, platformProperties.getFacebook(), http, state);
                case INSTAGRAM -> MetaGraphConnector.create(platform, platformProperties.getInstagram(), http, state);
                case LINKEDIN -> LinkedInConnector.create(platformProperties.getLinkedin(), http, objectMapper, state);
            };
        } catch (RuntimeException e) {
            return ConnectorCreation.failed("construction raised: " + e.getMessage());
        }
    }

    public PlatformConnector createSimulated(Platform platform) {
        return new SimulatedConnector(
                newState(platform),
                SimulationProfile.of(platform),
                random,
                connectorProperties.getSimulatedConnectLatency(),
                connectorProperties.getSimulatedSendLatency());
    }

    private ConnectorState newState(Platform platform) {
        RateLimiter rateLimiter = new RateLimiter(platform.key(), requestsPerMinute(platform),
                connectorProperties.getRateLimitWindow(), clock);
        return new ConnectorState(platform.key(), rateLimiter);
    }

    private int requestsPerMinute(Platform platform) {
        Integer configured = switch (platform) {
            case TELEGRAM -> platformProperties.getTelegram().getRequestsPerMinute();
            case GMAIL -> platformProperties.getGmail().getRequestsPerMinute();
            case FACEBOOK -> platformProperties.getFacebook().getRequestsPerMinute();
            case INSTAGRAM -> platformProperties.getInstagram().getRequestsPerMinute();
            case LINKEDIN -> platformProperties.getLinkedin().getRequestsPerMinute();
        };
        return configured != null && configured > 0 ? configured : platformProperties.getDefaultRequestsPerMinute();
    }
}
