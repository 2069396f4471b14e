package com.abba.answerdesk.infrastructure.gmail;

import com.abba.answerdesk.application.connector.ConnectorCreation;
import com.abba.answerdesk.application.connector.ConnectorState;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.PlatformConnector;
import com.abba.answerdesk.infrastructure.config.PlatformProperties;
import com.abba.answerdesk.infrastructure.http.ConnectorHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public class GmailConnector implements PlatformConnector {

    private static final Pattern ADDRESS = Pattern.compile("<([^>]+)>");

    private final PlatformProperties.Gmail properties;
    private final ConnectorHttpClient http;
    private final ConnectorState state;

    private GmailConnector(PlatformProperties.Gmail properties, ConnectorHttpClient http, ConnectorState state) {
        this.properties = properties;
        this.http = http;
        this.state = state;
    }

    public static ConnectorCreation create(PlatformProperties.Gmail properties, ConnectorHttpClient http, ConnectorState state) {
        if (properties.getAccessToken() == null || properties.getAccessToken().isBlank()) {
            return ConnectorCreation.failed("Gmail access token not configured");
        }
        return ConnectorCreation.created(new GmailConnector(properties, http, state));
    }

    @Override
    public String platform() {
        return state.getPlatform();
    }

    @Override
    public boolean connect() {
        boolean connected = state.connect(() -> {
            JsonNode profile = http.get(userUrl("/profile"), properties.getAccessToken());
            log.info("Connected to Gmail mailbox {}", profile.path("emailAddress").asText("unknown"));
        });
        if (!connected) {
            log.warn("Gmail connection failed: {}", state.getLastError());
        }
        return connected;
    }

    @Override
    public List<RawMessage> fetchMessages() {
        return state.call("fetch", this::listUnread, List.of());
    }

    @Override
    public boolean sendMessage(String recipient, String content) {
        return state.call("send", () -> {
            String mime = "To: " + recipient + "\r\n"
                    + "Subject: Re: your message\r\n"
                    + "Content-Type: text/plain; charset=UTF-8\r\n\r\n"
                    + content;
            String raw = Base64.getUrlEncoder().withoutPadding().encodeToString(mime.getBytes(StandardCharsets.UTF_8));
            JsonNode sent = http.postJson(userUrl("/messages/send"), properties.getAccessToken(), Map.of("raw", raw));
            return sent.hasNonNull("id");
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

    private List<RawMessage> listUnread() {
        String query = URLEncoder.encode(properties.getQuery(), StandardCharsets.UTF_8);
        JsonNode list = http.get(userUrl("/messages?q=" + query + "&maxResults=" + properties.getMaxResults()),
                properties.getAccessToken());

        List<RawMessage> messages = new ArrayList<>();
        for (JsonNode ref : list.path("messages")) {
            String id = ref.path("id").asText(null);
            if (id == null) {
                continue;
            }
            JsonNode detail = http.get(userUrl("/messages/" + id + "?format=metadata&metadataHeaders=From&metadataHeaders=Subject"),
                    properties.getAccessToken());
            String from = header(detail, "From");
            String subject = header(detail, "Subject");
            String snippet = detail.path("snippet").asText("");
            String content = subject == null || subject.isBlank() ? snippet : subject + "\n" + snippet;
            if (from == null || content.isBlank()) {
                continue;
            }
            messages.add(new RawMessage(
                    platform(),
                    id,
                    from,
                    extractAddress(from),
                    content,
                    OffsetDateTime.ofInstant(Instant.ofEpochMilli(detail.path("internalDate").asLong()), ZoneOffset.UTC)
            ));
        }
        return messages;
    }

    private String header(JsonNode detail, String name) {
        for (JsonNode header : detail.path("payload").path("headers")) {
            if (name.equalsIgnoreCase(header.path("name").asText())) {
                return header.path("value").asText(null);
            }
        }
        return null;
    }

    static String extractAddress(String from) {
        Matcher matcher = ADDRESS.matcher(from);
        return matcher.find() ? matcher.group(1) : from.trim();
    }

    private String userUrl(String path) {
        return properties.getApiBaseUrl() + "/users/me" + path;
    }
}
