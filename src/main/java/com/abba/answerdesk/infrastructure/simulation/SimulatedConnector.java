package com.abba.answerdesk.infrastructure.simulation;

import com.abba.answerdesk.application.connector.ConnectorState;
import com.abba.answerdesk.domain.exception.TransientProviderException;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.PlatformConnector;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Random;
import java.util.UUID;

@Slf4j
public class SimulatedConnector implements PlatformConnector {

    private final ConnectorState state;
    private final SimulationProfile profile;
    private final Random random;
    private final Duration connectLatency;
    private final Duration sendLatency;

    public SimulatedConnector(ConnectorState state, SimulationProfile profile, Random random,
                              Duration connectLatency, Duration sendLatency) {
        this.state = state;
        this.profile = profile;
        this.random = random;
        this.connectLatency = connectLatency;
        this.sendLatency = sendLatency;
    }

    @Override
    public String platform() {
        return state.getPlatform();
    }

    @Override
    public boolean connect() {
        return state.connect(() -> {
            log.info("Connecting to {}...", platform());
            pause(connectLatency);
            log.info("Connected to {}", platform());
        });
    }

    @Override
    public List<RawMessage> fetchMessages() {
        return state.call("fetch", () -> {
            if (profile.templates().isEmpty() || random.nextDouble() >= profile.newMessageProbability()) {
                return List.<RawMessage>of();
            }
            SimulationProfile.Template template = profile.templates().get(random.nextInt(profile.templates().size()));
            return List.of(new RawMessage(
                    platform(),
                    UUID.randomUUID().toString(),
                    template.sender(),
                    template.sender(),
                    template.content(),
                    OffsetDateTime.now()));
        }, List.of());
    }

    @Override
    public boolean sendMessage(String recipient, String content) {
        return state.call("send", () -> {
            log.info("Sending {} message to {}: {}", platform(), recipient, preview(content));
            pause(sendLatency);
            return true;
        }, false);
    }

    @Override
    public boolean isConnected() {
        return state.isConnected();
    }

    @Override
    public String lastError() {
        return state.getLastError();
    }

    @Override
    public long requestCount() {
        return state.getRequestCount();
    }

    private void pause(Duration latency) {
        if (latency.isZero() || latency.isNegative()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientProviderException(platform(), "Interrupted while simulating latency", e);
        }
    }

    private String preview(String content) {
        return content == null || content.length() <= 50 ? content : content.substring(0, 50) + "...";
    }
}
