package com.abba.answerdesk.infrastructure.meta;

import com.abba.answerdesk.application.connector.ConnectorCreation;
import com.abba.answerdesk.application.connector.ConnectorState;
import com.abba.answerdesk.domain.model.Platform;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.PlatformConnector;
import com.abba.answerdesk.infrastructure.config.PlatformProperties;
import com.abba.answerdesk.infrastructure.http.ConnectorHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public class MetaGraphConnector implements PlatformConnector {

    private static final DateTimeFormatter GRAPH_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final PlatformProperties.Meta properties;
    private final String conversationPlatform;
    private final ConnectorHttpClient http;
    private final ConnectorState state;
    private volatile String accountId;

    private MetaGraphConnector(PlatformProperties.Meta properties, String conversationPlatform,
                               ConnectorHttpClient http, ConnectorState state) {
        this.properties = properties;
        this.conversationPlatform = conversationPlatform;
        this.http = http;
        this.state = state;
    }

    public static ConnectorCreation create(Platform platform, PlatformProperties.Meta properties,
                                           ConnectorHttpClient http, ConnectorState state) {
        if (platform != Platform.FACEBOOK && platform != Platform.INSTAGRAM) {
            return ConnectorCreation.failed("Graph API does not serve " + platform.key());
        }
        if (properties.getAccessToken() == null || properties.getAccessToken().isBlank()) {
            return ConnectorCreation.failed(platform.displayName() + " access token not configured");
        }
        String conversationPlatform = platform == Platform.FACEBOOK ? "messenger" : "instagram";
        return ConnectorCreation.created(new MetaGraphConnector(properties, conversationPlatform, http, state));
    }

    @Override
    public String platform() {
        return state.getPlatform();
    }

    @Override
    public boolean connect() {
        boolean connected = state.connect(() -> {
            JsonNode account = http.get(url("?fields=id,name"), properties.getAccessToken());
            accountId = account.path("id").asText(null);
            log.info("Connected to {} as {}", platform(), account.path("name").asText("unknown"));
        });
        if (!connected) {
            log.warn("{} connection failed: {}", platform(), state.getLastError());
        }
        return connected;
    }

    @Override
    public List<RawMessage> fetchMessages() {
        return state.call("fetch", this::listConversations, List.of());
    }

    @Override
    public boolean sendMessage(String recipient, String content) {
        return state.call("send", () -> {
            Map<String, Object> payload = Map.of(
                    "recipient", Map.of("id", recipient),
                    "message", Map.of("text", content),
                    "messaging_type", "RESPONSE");
            JsonNode sent = http.postJson(url("/messages"), properties.getAccessToken(), payload);
            return sent.hasNonNull("message_id");
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

    private List<RawMessage> listConversations() {
        JsonNode root = http.get(url("/conversations?platform=" + conversationPlatform
                + "&fields=messages.limit(5){id,message,from,created_time}"), properties.getAccessToken());

        List<RawMessage> messages = new ArrayList<>();
        for (JsonNode conversation : root.path("data")) {
            for (JsonNode message : conversation.path("messages").path("data")) {
                JsonNode from = message.path("from");
                String fromId = from.path("id").asText(null);
                String text = message.path("message").asText(null);
                if (fromId == null || fromId.equals(accountId) || text == null || text.isBlank()) {
                    continue;
                }
                String sender = from.hasNonNull("name") ? from.get("name").asText() : from.path("username").asText(fromId);
                messages.add(new RawMessage(
                        platform(),
                        message.path("id").asText(),
                        sender,
                        fromId,
                        text,
                        parseTime(message.path("created_time").asText(null))
                ));
            }
        }
        return messages;
    }

    private OffsetDateTime parseTime(String value) {
        if (value == null) {
            return OffsetDateTime.now();
        }
        try {
            return OffsetDateTime.parse(value, GRAPH_TIME);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Graph timestamp {}", value);
            return OffsetDateTime.now();
        }
    }

    private String url(String path) {
        return properties.getApiBaseUrl() + "/" + properties.getPageId() + path;
    }
}
