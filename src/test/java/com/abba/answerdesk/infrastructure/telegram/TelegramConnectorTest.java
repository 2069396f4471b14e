package com.abba.answerdesk.infrastructure.telegram;

import com.abba.answerdesk.application.connector.ConnectorCreation;
import com.abba.answerdesk.application.connector.ConnectorState;
import com.abba.answerdesk.application.connector.RateLimiter;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.PlatformConnector;
import com.abba.answerdesk.infrastructure.config.ConnectorProperties;
import com.abba.answerdesk.infrastructure.config.PlatformProperties;
import com.abba.answerdesk.infrastructure.http.ConnectorHttpClient;
import com.abba.answerdesk.support.MutableClock;
import com.abba.answerdesk.support.StubInterceptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramConnectorTest {

    private static final String UPDATES = """
            {"ok":true,"result":[
              {"update_id":100,"message":{"message_id":7,"date":1714557600,"text":"Hey, free tomorrow?",
                "chat":{"id":4242},"from":{"username":"alice"}}},
              {"update_id":101,"edited_message":{"message_id":8,"text":"edited"}},
              {"update_id":102,"message":{"message_id":9,"date":1714557660,"text":"Thanks!",
                "chat":{"id":5151},"from":{"first_name":"Bob","last_name":"Stone"}}}
            ]}
            """;

    private StubInterceptor stub;
    private PlatformProperties.Telegram properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        stub = new StubInterceptor();
        properties = new PlatformProperties.Telegram();
        properties.setApiBaseUrl("https://telegram.test");
        properties.setBotToken("TOKEN");
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    }

    private PlatformConnector connector(int requestsPerMinute) {
        ConnectorProperties connectorProperties = new ConnectorProperties();
        connectorProperties.setRetryBaseDelay(Duration.ofMillis(1));
        ConnectorHttpClient http = new ConnectorHttpClient("telegram", stub.client(), new ObjectMapper(), connectorProperties);
        ConnectorState state = new ConnectorState("telegram",
                new RateLimiter("telegram", requestsPerMinute, Duration.ofSeconds(60), clock));
        ConnectorCreation creation = TelegramConnector.create(properties, http, state);
        assertThat(creation.isCreated()).isTrue();
        return creation.connector();
    }

    @Test
    void creationFailsWithoutBotToken() {
        properties.setBotToken(" ");

        ConnectorCreation creation = TelegramConnector.create(properties, null, null);

        assertThat(creation.isCreated()).isFalse();
        assertThat(creation.failureReason()).contains("token");
    }

    @Test
    void fetchParsesTextMessagesAndAdvancesTheOffset() {
        stub.on("/getMe", 200, "{\"ok\":true,\"result\":{\"username\":\"desk_bot\"}}")
                .on("/getUpdates", 200, UPDATES)
                .on("/getUpdates", 200, "{\"ok\":true,\"result\":[]}");
        PlatformConnector connector = connector(30);

        assertThat(connector.connect()).isTrue();
        List<RawMessage> messages = connector.fetchMessages();
        connector.fetchMessages();

        assertThat(messages).extracting(RawMessage::sender).containsExactly("alice", "Bob Stone");
        assertThat(messages).extracting(RawMessage::replyTo).containsExactly("4242", "5151");
        assertThat(messages.get(0).externalId()).isEqualTo("7");
        assertThat(messages.get(0).content()).isEqualTo("Hey, free tomorrow?");
        assertThat(stub.requests().get(2).url().queryParameter("offset")).isEqualTo("103");
        assertThat(connector.requestCount()).isEqualTo(2);
    }

    @Test
    void exhaustedBudgetReturnsEmptyWithoutNetworkAccess() {
        stub.on("/getMe", 200, "{\"ok\":true,\"result\":{}}")
                .on("/getUpdates", 200, "{\"ok\":true,\"result\":[]}");
        PlatformConnector connector = connector(1);
        connector.connect();

        connector.fetchMessages();
        List<RawMessage> second = connector.fetchMessages();
        boolean sent = connector.sendMessage("4242", "hello");

        assertThat(second).isEmpty();
        assertThat(sent).isFalse();
        assertThat(stub.count("/getUpdates")).isEqualTo(1);
        assertThat(stub.count("/sendMessage")).isZero();
        assertThat(connector.lastError()).contains("budget");
        assertThat(connector.isConnected()).isTrue();
    }

    @Test
    void rejectedTokenDisablesTheConnectorForGood() {
        stub.on("/getMe", 401, "{\"ok\":false,\"error_code\":401,\"description\":\"Unauthorized\"}");
        PlatformConnector connector = connector(30);

        assertThat(connector.connect()).isFalse();
        assertThat(connector.connect()).isFalse();

        assertThat(stub.count("/getMe")).isEqualTo(1);
        assertThat(connector.fetchMessages()).isEmpty();
        assertThat(stub.count("/getUpdates")).isZero();
    }

    @Test
    void sendPostsToTheChat() {
        stub.on("/getMe", 200, "{\"ok\":true,\"result\":{}}")
                .on("/sendMessage", 200, "{\"ok\":true}");
        PlatformConnector connector = connector(30);
        connector.connect();

        assertThat(connector.sendMessage("4242", "On my way")).isTrue();
        assertThat(stub.count("/botTOKEN/sendMessage")).isEqualTo(1);
    }

    @Test
    void sendReportsFailureWhenTelegramRefuses() {
        stub.on("/getMe", 200, "{\"ok\":true,\"result\":{}}")
                .on("/sendMessage", 200, "{\"ok\":false,\"error_code\":400,\"description\":\"chat not found\"}");
        PlatformConnector connector = connector(30);
        connector.connect();

        assertThat(connector.sendMessage("0", "hello")).isFalse();
        assertThat(connector.lastError()).contains("chat not found");
        assertThat(connector.isConnected()).isTrue();
    }
}
