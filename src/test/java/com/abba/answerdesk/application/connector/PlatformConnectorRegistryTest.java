package com.abba.answerdesk.application.connector;

import com.abba.answerdesk.domain.model.Platform;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.PlatformConnector;
import com.abba.answerdesk.infrastructure.config.PlatformProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlatformConnectorRegistryTest {

    private ConnectorFactory factory;
    private PlatformConnector telegram;
    private PlatformConnector gmail;
    private PlatformConnectorRegistry registry;

    @BeforeEach
    void setUp() {
        factory = mock(ConnectorFactory.class);
        telegram = mock(PlatformConnector.class);
        gmail = mock(PlatformConnector.class);
        when(factory.select(Platform.TELEGRAM))
                .thenReturn(new ConnectorSelection("telegram", telegram, ConnectorVariant.REAL, null));
        when(factory.select(Platform.GMAIL))
                .thenReturn(new ConnectorSelection("gmail", gmail, ConnectorVariant.SIMULATED, "token missing"));

        PlatformProperties properties = new PlatformProperties();
        properties.setEnabled(List.of("telegram", "gmail", "myspace"));
        registry = new PlatformConnectorRegistry(factory, properties);
    }

    private static RawMessage raw(String platform, String content) {
        return new RawMessage(platform, "ext-" + content, "alice", "42", content, OffsetDateTime.now());
    }

    @Test
    void initializeSkipsUnknownPlatforms() {
        Map<String, ConnectorVariant> variants = registry.initialize();

        assertThat(variants).containsExactly(
                Map.entry("telegram", ConnectorVariant.REAL),
                Map.entry("gmail", ConnectorVariant.SIMULATED));
    }

    @Test
    void initializeKeepsOtherPlatformsWhenOneFails() {
        when(factory.select(Platform.TELEGRAM)).thenThrow(new IllegalStateException("boom"));

        assertThat(registry.initialize()).containsOnlyKeys("gmail");
    }

    @Test
    void connectAllIsolatesFailures() {
        when(telegram.connect()).thenThrow(new IllegalStateException("handshake exploded"));
        when(gmail.connect()).thenReturn(true);
        registry.initialize();

        Map<String, Boolean> results = registry.connectAll();

        assertThat(results).containsEntry("telegram", false).containsEntry("gmail", true);
    }

    @Test
    void getAllMessagesPollsOnlyConnectedPlatformsAndTagsTheSource() {
        when(telegram.isConnected()).thenReturn(false);
        when(gmail.isConnected()).thenReturn(true);
        when(gmail.fetchMessages()).thenReturn(List.of(raw("something-else", "Invoice attached")));
        registry.initialize();

        List<RawMessage> messages = registry.getAllMessages();

        assertThat(messages).singleElement().extracting(RawMessage::platform).isEqualTo("gmail");
        verify(telegram, never()).fetchMessages();
    }

    @Test
    void getAllMessagesSkipsAFailingPlatform() {
        when(telegram.isConnected()).thenReturn(true);
        when(telegram.fetchMessages()).thenThrow(new IllegalStateException("parse error"));
        when(gmail.isConnected()).thenReturn(true);
        when(gmail.fetchMessages()).thenReturn(List.of(raw("gmail", "one"), raw("gmail", "two")));
        registry.initialize();

        assertThat(registry.getAllMessages()).extracting(RawMessage::content).containsExactly("one", "two");
    }

    @Test
    void sendMessageRejectsUnknownAndDisconnectedPlatforms() {
        when(telegram.isConnected()).thenReturn(false);
        registry.initialize();

        assertThat(registry.sendMessage("myspace", "tom", "hi")).isFalse();
        assertThat(registry.sendMessage(null, "tom", "hi")).isFalse();
        assertThat(registry.sendMessage("telegram", "42", "hi")).isFalse();
        verify(telegram, never()).sendMessage(anyString(), anyString());
    }

    @Test
    void sendMessageDelegatesToTheConnectedPlatform() {
        when(gmail.isConnected()).thenReturn(true);
        when(gmail.sendMessage("bob@example.com", "Thanks!")).thenReturn(true);
        registry.initialize();

        assertThat(registry.sendMessage("Gmail", "bob@example.com", "Thanks!")).isTrue();
    }

    @Test
    void sendMessageTurnsConnectorCrashesIntoFalse() {
        when(gmail.isConnected()).thenReturn(true);
        when(gmail.sendMessage(anyString(), anyString())).thenThrow(new IllegalStateException("socket closed"));
        registry.initialize();

        assertThat(registry.sendMessage("gmail", "bob@example.com", "Thanks!")).isFalse();
    }

    @Test
    void connectionStatusReportsVariantAndCounters() {
        when(gmail.isConnected()).thenReturn(true);
        when(gmail.requestCount()).thenReturn(4L);
        registry.initialize();

        ConnectorStatus status = registry.getConnectionStatus().get("gmail");

        assertThat(status.variant()).isEqualTo(ConnectorVariant.SIMULATED);
        assertThat(status.connected()).isTrue();
        assertThat(status.requestCount()).isEqualTo(4L);
        assertThat(status.substitutionReason()).isEqualTo("token missing");
    }
}
