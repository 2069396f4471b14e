package com.abba.answerdesk.infrastructure.telegram;

import com.abba.answerdesk.application.messaging.conversation.OperatorReply;
import com.abba.answerdesk.application.messaging.conversation.OperatorReply.SuggestedAction;
import com.abba.answerdesk.application.notification.OperatorGateway;
import com.abba.answerdesk.infrastructure.config.OperatorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class TelegramOperatorGateway implements OperatorGateway {

    private static final Logger log = LoggerFactory.getLogger(TelegramOperatorGateway.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OperatorProperties properties;
    private final OkHttpClient client;
    private final ObjectMapper objectMapper;

    public TelegramOperatorGateway(OperatorProperties properties, OkHttpClient client, ObjectMapper objectMapper) {
        this.properties = properties;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean send(String text) {
        OperatorProperties.Telegram telegram = properties.getTelegram();
        if (!isConfigured(telegram)) {
            log.info("[Operator channel disabled] {}", text);
            return true;
        }
        return post("sendMessage", Map.of("chat_id", telegram.getChatId(), "text", text));
    }

    public boolean reply(String chatId, OperatorReply reply) {
        if (!isConfigured(properties.getTelegram())) {
            log.info("[Operator channel disabled] reply to chat={}: {}", mask(chatId), reply.text());
            return true;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", reply.text());
        if (!reply.actions().isEmpty()) {
            payload.put("reply_markup", Map.of("inline_keyboard", keyboard(reply.actions())));
        }
        return post("sendMessage", payload);
    }

    public void acknowledge(String callbackQueryId) {
        if (callbackQueryId == null || !isConfigured(properties.getTelegram())) {
            return;
        }
        if (!post("answerCallbackQuery", Map.of("callback_query_id", callbackQueryId))) {
            log.debug("Callback query {} was not acknowledged", callbackQueryId);
        }
    }

    private List<List<Map<String, String>>> keyboard(List<SuggestedAction> actions) {
        return actions.stream()
                .map(action -> List.of(Map.of("text", action.label(), "callback_data", action.command())))
                .toList();
    }

    private boolean post(String method, Map<String, ?> payload) {
        OperatorProperties.Telegram telegram = properties.getTelegram();
        try {
            String body = objectMapper.writeValueAsString(payload);
            Request request = new Request.Builder()
                    .url(telegram.getApiBaseUrl() + "/bot" + telegram.getBotToken() + "/" + method)
                    .post(RequestBody.create(body, JSON))
                    .build();
            try (Response response = client.newCall(request).execute()) {
                String responseBody = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    log.warn("Operator {} rejected. status={} chat={}", method, response.code(), mask(telegram.getChatId()));
                    return false;
                }
                JsonNode root = objectMapper.readTree(responseBody);
                return root.path("ok").asBoolean(false);
            }
        } catch (IOException e) {
            log.error("Failed to call operator {}: {}", method, e.getMessage(), e);
            return false;
        }
    }

    private boolean isConfigured(OperatorProperties.Telegram telegram) {
        return telegram.isEnabled() && !isBlank(telegram.getBotToken()) && !isBlank(telegram.getChatId());
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 6) return "***";
        return v.substring(0, 3) + "***" + v.substring(v.length() - 3);
    }
}
