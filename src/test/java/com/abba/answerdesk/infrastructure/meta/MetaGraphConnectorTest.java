package com.abba.answerdesk.infrastructure.meta;

import com.abba.answerdesk.application.connector.ConnectorCreation;
import com.abba.answerdesk.application.connector.ConnectorState;
import com.abba.answerdesk.application.connector.RateLimiter;
import com.abba.answerdesk.domain.model.Platform;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.PlatformConnector;
import com.abba.answerdesk.infrastructure.config.ConnectorProperties;
import com.abba.answerdesk.infrastructure.config.PlatformProperties;
import com.abba.answerdesk.infrastructure.http.ConnectorHttpClient;
import com.abba.answerdesk.support.StubInterceptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetaGraphConnectorTest {

    private StubInterceptor stub;
    private PlatformProperties.Meta properties;

    @BeforeEach
    void setUp() {
        stub = new StubInterceptor();
        properties = new PlatformProperties.Meta();
        properties.setApiBaseUrl("https://graph.test/v19.0");
        properties.setAccessToken("page-token");
        properties.setPageId("123");
    }

    private ConnectorCreation create(Platform platform) {
        ConnectorProperties connectorProperties = new ConnectorProperties();
        connectorProperties.setRetryBaseDelay(Duration.ofMillis(1));
        ConnectorHttpClient http = new ConnectorHttpClient(platform.key(), stub.client(), new ObjectMapper(), connectorProperties);
        ConnectorState state = new ConnectorState(platform.key(),
                new RateLimiter(platform.key(), 20, Duration.ofSeconds(60), Clock.systemUTC()));
        return MetaGraphConnector.create(platform, properties, http, state);
    }

    @Test
    void onlyServesFacebookAndInstagram() {
        assertThat(create(Platform.GMAIL).isCreated()).isFalse();
    }

    @Test
    void fetchSkipsThePagesOwnMessages() {
        stub.on("/123?fields", 200, "{\"id\":\"123\",\"name\":\"My Page\"}")
                .on("/123/conversations", 200, """
                        {"data":[{"messages":{"data":[
                          {"id":"mid.1","message":"Happy birthday!","from":{"id":"555","name":"Friend1"},
                           "created_time":"2024-05-01T10:00:00+0000"},
                          {"id":"mid.2","message":"Thanks!","from":{"id":"123","name":"My Page"}}
                        ]}}]}
                        """);
        PlatformConnector connector = create(Platform.FACEBOOK).connector();

        assertThat(connector.connect()).isTrue();
        List<RawMessage> messages = connector.fetchMessages();

        assertThat(messages).singleElement().satisfies(message -> {
            assertThat(message.sender()).isEqualTo("Friend1");
            assertThat(message.replyTo()).isEqualTo("555");
            assertThat(message.externalId()).isEqualTo("mid.1");
        });
        assertThat(stub.requests().get(1).url().queryParameter("platform")).isEqualTo("messenger");
    }

    @Test
    void sendUsesThePageScopedRecipient() {
        stub.on("/123?fields", 200, "{\"id\":\"123\"}")
                .on("/123/messages", 200, "{\"recipient_id\":\"555\",\"message_id\":\"m_1\"}");
        PlatformConnector connector = create(Platform.INSTAGRAM).connector();
        connector.connect();

        assertThat(connector.sendMessage("555", "Thank you!")).isTrue();
    }
}
