package com.abba.answerdesk.infrastructure.linkedin;

import com.abba.answerdesk.application.connector.ConnectorCreation;
import com.abba.answerdesk.application.connector.ConnectorState;
import com.abba.answerdesk.domain.exception.ConnectorException;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.PlatformConnector;
import com.abba.answerdesk.infrastructure.config.PlatformProperties;
import com.abba.answerdesk.infrastructure.http.ConnectorHttpClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public class LinkedInConnector implements PlatformConnector {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final PlatformProperties.LinkedIn properties;
    private final ConnectorHttpClient http;
    private final ObjectMapper objectMapper;
    private final ConnectorState state;
    private volatile String memberUrn;

    private LinkedInConnector(PlatformProperties.LinkedIn properties, ConnectorHttpClient http,
                              ObjectMapper objectMapper, ConnectorState state) {
        this.properties = properties;
        this.http = http;
        this.objectMapper = objectMapper;
        this.state = state;
    }

    public static ConnectorCreation create(PlatformProperties.LinkedIn properties, ConnectorHttpClient http,
                                           ObjectMapper objectMapper, ConnectorState state) {
        if (properties.getAccessToken() == null || properties.getAccessToken().isBlank()) {
            return ConnectorCreation.failed("LinkedIn access token not configured");
        }
        return ConnectorCreation.created(new LinkedInConnector(properties, http, objectMapper, state));
    }

    @Override
    public String platform() {
        return state.getPlatform();
    }

    @Override
    public boolean connect() {
        boolean connected = state.connect(() -> {
            JsonNode userInfo = http.execute(request("/v2/userinfo").get().build());
            memberUrn = "urn:li:person:" + userInfo.path("sub").asText();
            log.info("Connected to LinkedIn as {}", userInfo.path("name").asText("unknown"));
        });
        if (!connected) {
            log.warn("LinkedIn connection failed: {}", state.getLastError());
        }
        return connected;
    }

    @Override
    public List<RawMessage> fetchMessages() {
        return state.call("fetch", this::listInbox, List.of());
    }

    @Override
    public boolean sendMessage(String recipient, String content) {
        return state.call("send", () -> {
            Map<String, Object> payload = Map.of(
                    "recipients", List.of(recipient),
                    "body", Map.of("text", content));
            String body;
            try {
                body = objectMapper.writeValueAsString(payload);
            } catch (JsonProcessingException e) {
                throw new ConnectorException(platform(), "Unable to serialize LinkedIn message", e);
            }
            http.execute(request("/rest/messages").post(RequestBody.create(body, JSON)).build());
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

    private List<RawMessage> listInbox() {
        JsonNode root = http.execute(request("/rest/messages?q=inbox&count=10").get().build());
        List<RawMessage> messages = new ArrayList<>();
        for (JsonNode element : root.path("elements")) {
            JsonNode sender = element.path("sender");
            String senderUrn = sender.path("urn").asText(null);
            String text = element.path("body").path("text").asText(null);
            if (senderUrn == null || senderUrn.equals(memberUrn) || text == null || text.isBlank()) {
                continue;
            }
            String headline = sender.path("headline").asText("");
            String name = sender.path("name").asText(senderUrn);
            messages.add(new RawMessage(
                    platform(),
                    element.path("entityUrn").asText(),
                    headline.isBlank() ? name : name + " (" + headline + ")",
                    senderUrn,
                    text,
                    OffsetDateTime.ofInstant(Instant.ofEpochMilli(element.path("deliveredAt").asLong()), ZoneOffset.UTC)
            ));
        }
        return messages;
    }

    private Request.Builder request(String path) {
        return new Request.Builder()
                .url(properties.getApiBaseUrl() + path)
                .addHeader("Authorization", "Bearer " + properties.getAccessToken())
                .addHeader("LinkedIn-Version", properties.getApiVersion())
                .addHeader("X-Restli-Protocol-Version", "2.0.0");
    }
}
