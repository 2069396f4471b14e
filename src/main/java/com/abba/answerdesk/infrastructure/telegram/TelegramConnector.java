package com.abba.answerdesk.infrastructure.telegram;

import com.abba.answerdesk.application.connector.ConnectorCreation;
import com.abba.answerdesk.application.connector.ConnectorState;
import com.abba.answerdesk.domain.exception.AuthenticationException;
import com.abba.answerdesk.domain.exception.ConnectorException;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.PlatformConnector;
import com.abba.answerdesk.infrastructure.config.PlatformProperties;
import com.abba.answerdesk.infrastructure.http.ConnectorHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
public class TelegramConnector implements PlatformConnector {

    private final String baseUrl;
    private final ConnectorHttpClient http;
    private final ConnectorState state;
    private final AtomicLong nextOffset = new AtomicLong(0);

    private TelegramConnector(String baseUrl, ConnectorHttpClient http, ConnectorState state) {
        this.baseUrl = baseUrl;
        this.http = http;
        this.state = state;
    }

    public static ConnectorCreation create(PlatformProperties.Telegram properties, ConnectorHttpClient http, ConnectorState state) {
        if (properties.getBotToken() == null || properties.getBotToken().isBlank()) {
            return ConnectorCreation.failed("Telegram bot token not configured");
        }
        String baseUrl = properties.getApiBaseUrl() + "/bot" + properties.getBotToken();
        return ConnectorCreation.created(new TelegramConnector(baseUrl, http, state));
    }

    @Override
    public String platform() {
        return state.getPlatform();
    }

    @Override
    public boolean connect() {
        boolean connected = state.connect(() -> {
            JsonNode me = requireOk(http.get(baseUrl + "/getMe", null));
            log.info("Connected to Telegram as @{}", me.path("result").path("username").asText("unknown"));
        });
        if (!connected) {
            log.warn("Telegram connection failed: {}", state.getLastError());
        }
        return connected;
    }

    @Override
    public List<RawMessage> fetchMessages() {
        return state.call("fetch", this::pollUpdates, List.of());
    }

    @Override
    public boolean sendMessage(String recipient, String content) {
        return state.call("send", () -> {
            requireOk(http.postJson(baseUrl + "/sendMessage", null, Map.of("chat_id", recipient, "text", content)));
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

    private List<RawMessage> pollUpdates() {
        JsonNode root = requireOk(http.get(baseUrl + "/getUpdates?timeout=0&offset=" + nextOffset.get(), null));
        List<RawMessage> messages = new ArrayList<>();
        for (JsonNode update : root.path("result")) {
            long updateId = update.path("update_id").asLong();
            nextOffset.accumulateAndGet(updateId + 1, Math::max);

            JsonNode message = update.path("message");
            String text = message.path("text").asText(null);
            if (message.isMissingNode() || text == null || text.isBlank()) {
                continue;
            }
            JsonNode from = message.path("from");
            String sender = from.hasNonNull("username")
                    ? from.get("username").asText()
                    : (from.path("first_name").asText("") + " " + from.path("last_name").asText("")).trim();
            messages.add(new RawMessage(
                    platform(),
                    String.valueOf(message.path("message_id").asLong()),
                    sender.isBlank() ? "unknown" : sender,
                    message.path("chat").path("id").asText(),
                    text,
                    OffsetDateTime.ofInstant(Instant.ofEpochSecond(message.path("date").asLong()), ZoneOffset.UTC)
            ));
        }
        return messages;
    }

    private JsonNode requireOk(JsonNode response) {
        if (!response.path("ok").asBoolean(false)) {
            String description = response.path("description").asText("unknown error");
            if (response.path("error_code").asInt() == 401) {
                throw new AuthenticationException(platform(), description);
            }
            throw new ConnectorException(platform(), "Telegram API error: " + description);
        }
        return response;
    }
}
