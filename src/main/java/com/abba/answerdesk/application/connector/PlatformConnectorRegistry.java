package com.abba.answerdesk.application.connector;

import com.abba.answerdesk.domain.model.Platform;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.PlatformConnector;
import com.abba.answerdesk.infrastructure.config.PlatformProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class PlatformConnectorRegistry {

    private final ConnectorFactory connectorFactory;
    private final PlatformProperties platformProperties;

    private volatile Map<String, ConnectorSelection> selections = Map.of();

    public PlatformConnectorRegistry(ConnectorFactory connectorFactory, PlatformProperties platformProperties) {
        this.connectorFactory = connectorFactory;
        this.platformProperties = platformProperties;
    }

    public synchronized Map<String, ConnectorVariant> initialize() {
        Map<String, ConnectorSelection> selected = new LinkedHashMap<>();
        for (String key : platformProperties.getEnabled()) {
            Optional<Platform> platform = Platform.fromKey(key);
            if (platform.isEmpty()) {
                log.warn("Ignoring unknown platform '{}'", key);
                continue;
            }
            try {
                ConnectorSelection selection = connectorFactory.select(platform.get());
                selected.put(platform.get().key(), selection);
            } catch (RuntimeException e) {
                log.error("Could not initialize connector for {}: {}", key, e.getMessage(), e);
            }
        }
        this.selections = Collections.unmodifiableMap(selected);

        Map<String, ConnectorVariant> variants = new LinkedHashMap<>();
        selected.forEach((key, selection) -> variants.put(key, selection.variant()));
        return variants;
    }

    public Map<String, Boolean> connectAll() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (ConnectorSelection selection : selections.values()) {
            boolean connected;
            try {
                connected = selection.connector().connect();
            } catch (RuntimeException e) {
                log.error("Error connecting to {}: {}", selection.platform(), e.getMessage());
                connected = false;
            }
            results.put(selection.platform(), connected);
        }
        return results;
    }

    public List<RawMessage> getAllMessages() {
        List<RawMessage> all = new ArrayList<>();
        for (ConnectorSelection selection : selections.values()) {
            PlatformConnector connector = selection.connector();
            try {
                if (!connector.isConnected()) {
                    continue;
                }
                List<RawMessage> messages = connector.fetchMessages();
                if (messages == null) {
                    continue;
                }
                for (RawMessage message : messages) {
                    all.add(message.withPlatform(selection.platform()));
                }
            } catch (RuntimeException e) {
                log.error("Error getting messages from {}: {}", selection.platform(), e.getMessage());
            }
        }
        return all;
    }

    public boolean sendMessage(String platform, String recipient, String content) {
        String key = platform == null ? "" : platform.trim().toLowerCase(Locale.ROOT);
        ConnectorSelection selection = selections.get(key);
        if (selection == null) {
            log.error("Unknown platform: {}", platform);
            return false;
        }
        PlatformConnector connector = selection.connector();
        try {
            if (!connector.isConnected()) {
                log.error("Not connected to {}", key);
                return false;
            }
            return connector.sendMessage(recipient, content);
        } catch (RuntimeException e) {
            log.error("Error sending message to {}: {}", key, e.getMessage());
            return false;
        }
    }

    public Map<String, ConnectorStatus> getConnectionStatus() {
        Map<String, ConnectorStatus> status = new LinkedHashMap<>();
        for (ConnectorSelection selection : selections.values()) {
            PlatformConnector connector = selection.connector();
            status.put(selection.platform(), new ConnectorStatus(
                    selection.platform(),
                    selection.variant(),
                    connector.isConnected(),
                    connector.lastError(),
                    connector.requestCount(),
                    selection.substitutionReason()));
        }
        return status;
    }
}
