package com.abba.answerdesk.application.service;

import com.abba.answerdesk.application.notification.OperatorGateway;
import com.abba.answerdesk.domain.model.Message;
import com.abba.answerdesk.domain.model.Platform;
import com.abba.answerdesk.domain.service.NotificationService;
import com.abba.answerdesk.infrastructure.config.OperatorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationServiceImpl implements NotificationService {

    private final OperatorGateway operatorGateway;
    private final OperatorProperties operatorProperties;

    @Override
    public void notifyNewMessage(Message message) {
        String platform = Platform.fromKey(message.getPlatform())
                .map(Platform::displayName)
                .orElse(message.getPlatform());
        String text = String.format("New %s message from %s (%s): %s%n%nUse next to process.",
                platform, message.getSender(), message.getCategory().key(), preview(message.getContent()));
        if (!operatorGateway.send(text)) {
            log.warn("Operator notification for message {} was not delivered", message.getId());
        }
    }

    private String preview(String content) {
        int limit = operatorProperties.getPreviewLength();
        if (content == null || content.length() <= limit) {
            return content;
        }
        return content.substring(0, limit) + "...";
    }
}
