package com.abba.answerdesk.infrastructure.telegram;

import com.abba.answerdesk.application.messaging.conversation.ConversationController;
import com.abba.answerdesk.application.messaging.conversation.OperatorReply;
import com.abba.answerdesk.infrastructure.config.OperatorProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhooks/telegram")
public class TelegramOperatorWebhookController {

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private static final Logger log = LoggerFactory.getLogger(TelegramOperatorWebhookController.class);

    private final OperatorProperties properties;
    private final ConversationController conversationController;
    private final TelegramOperatorGateway gateway;
    private final ObjectMapper objectMapper;

    public TelegramOperatorWebhookController(OperatorProperties properties,
                                             ConversationController conversationController,
                                             TelegramOperatorGateway gateway,
                                             ObjectMapper objectMapper) {
        this.properties = properties;
        this.conversationController = conversationController;
        this.gateway = gateway;
        this.objectMapper = objectMapper;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> receive(@RequestHeader(name = SECRET_HEADER, required = false) String secret,
                                        @RequestBody(required = false) String body) {
        OperatorProperties.Telegram telegram = properties.getTelegram();
        if (!telegram.isEnabled()) {
            log.info("[Operator channel disabled] Received Telegram update body length={}", body == null ? 0 : body.length());
            return ResponseEntity.ok().build();
        }
        String expectedSecret = telegram.getWebhookSecret();
        if (expectedSecret != null && !expectedSecret.isBlank() && !expectedSecret.equals(secret)) {
            log.warn("Telegram update rejected: secret token mismatch {}", mask(secret));
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        if (body == null || body.isBlank()) {
            log.warn("Empty Telegram update body");
            return ResponseEntity.ok().build();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse Telegram update: {}", e.getMessage());
            return ResponseEntity.ok().build();
        }

        String chatId;
        String input;
        JsonNode callback = root.path("callback_query");
        if (!callback.isMissingNode()) {
            chatId = text(callback.path("message").path("chat"), "id");
            input = text(callback, "data");
            gateway.acknowledge(text(callback, "id"));
        } else {
            JsonNode message = root.path("message");
            chatId = text(message.path("chat"), "id");
            input = text(message, "text");
        }

        if (chatId == null || input == null) {
            log.debug("Skipping Telegram update {} without chat or text", text(root, "update_id"));
            return ResponseEntity.ok().build();
        }
        if (!chatId.equals(telegram.getChatId())) {
            log.warn("Ignoring Telegram update from chat={} which is not the operator chat", mask(chatId));
            return ResponseEntity.ok().build();
        }

        OperatorReply reply = conversationController.handle(chatId, input);
        if (!gateway.reply(chatId, reply)) {
            log.warn("Reply to operator chat={} was not delivered", mask(chatId));
        }
        return ResponseEntity.ok().build();
    }

    private String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && !v.isNull() ? v.asText() : null;
    }

    private String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 6) return "***";
        return v.substring(0, 3) + "***" + v.substring(v.length() - 3);
    }
}
