package com.abba.answerdesk.infrastructure.config;

import com.abba.answerdesk.application.connector.ConnectorVariant;
import com.abba.answerdesk.application.connector.PlatformConnectorRegistry;
import com.abba.answerdesk.domain.exception.PersistenceException;
import com.abba.answerdesk.domain.service.MessageService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class AnswerDeskLifecycle {

    private final PlatformConnectorRegistry connectorRegistry;
    private final MessageService messageService;
    private final AnswerDeskProperties answerDeskProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("Starting AnswerDesk in {} mode", answerDeskProperties.getMode());
        Map<String, ConnectorVariant> variants = connectorRegistry.initialize();
        variants.forEach((platform, variant) -> log.info("{} connector: {}", platform, variant));

        Map<String, Boolean> connections = connectorRegistry.connectAll();
        long connected = connections.values().stream().filter(Boolean::booleanValue).count();
        log.info("Platform connections: {} ({}/{} connected)", connections, connected, connections.size());
    }

    @PreDestroy
    public void onShutdown() {
        if (!answerDeskProperties.isLocalMode()) {
            return;
        }
        try {
            messageService.clearAll();
            log.info("Local mode: stored messages and responses cleared");
        } catch (PersistenceException e) {
            log.error("Could not clear stored data on shutdown: {}", e.getMessage());
        }
    }
}
