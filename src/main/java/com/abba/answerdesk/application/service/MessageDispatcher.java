package com.abba.answerdesk.application.service;

import com.abba.answerdesk.application.connector.PlatformConnectorRegistry;
import com.abba.answerdesk.application.messaging.classifier.MessageClassifier;
import com.abba.answerdesk.domain.exception.PersistenceException;
import com.abba.answerdesk.domain.model.Message;
import com.abba.answerdesk.domain.model.MessageCategory;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.service.MessageService;
import com.abba.answerdesk.domain.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class MessageDispatcher {

    private final PlatformConnectorRegistry connectorRegistry;
    private final MessageClassifier messageClassifier;
    private final MessageService messageService;
    private final NotificationService notificationService;

    public DispatchResult dispatchOnce() {
        List<RawMessage> rawMessages = connectorRegistry.getAllMessages();
        if (rawMessages.isEmpty()) {
            return DispatchResult.empty();
        }

        int persisted = 0;
        int duplicates = 0;
        int failed = 0;
        for (RawMessage rawMessage : rawMessages) {
            try {
                if (messageService.isAlreadyReceived(rawMessage.platform(), rawMessage.externalId())) {
                    duplicates++;
                    continue;
                }
                MessageCategory category = messageClassifier.classify(rawMessage.content(), rawMessage.sender(), rawMessage.platform());
                Message message = messageService.receiveMessage(rawMessage, category);
                persisted++;
                notifyOperator(message);
                log.info("New message from {}: {}", message.getPlatform(), message.getSender());
            } catch (PersistenceException e) {
                failed++;
                log.error("Error storing message from {} ({}): {}", rawMessage.platform(), rawMessage.externalId(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("Error processing message from {} ({})", rawMessage.platform(), rawMessage.externalId(), e);
            }
        }

        DispatchResult result = new DispatchResult(rawMessages.size(), persisted, duplicates, failed);
        log.debug("Dispatch cycle finished: {}", result);
        return result;
    }

    private void notifyOperator(Message message) {
        try {
            notificationService.notifyNewMessage(message);
        } catch (RuntimeException e) {
            log.warn("Could not notify operator about message {}: {}", message.getId(), e.getMessage());
        }
    }
}
