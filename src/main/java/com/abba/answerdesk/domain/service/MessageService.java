package com.abba.answerdesk.domain.service;

import com.abba.answerdesk.domain.model.Message;
import com.abba.answerdesk.domain.model.MessageCategory;
import com.abba.answerdesk.domain.model.RawMessage;

import java.util.List;
import java.util.Optional;

public interface MessageService {

    Message receiveMessage(RawMessage rawMessage, MessageCategory category);

    boolean isAlreadyReceived(String platform, String externalId);

    Optional<Message> findById(String id);

    Optional<Message> getNextPendingMessage();

    List<Message> getPendingMessages();

    boolean markAsProcessing(String id);

    boolean markAsAnswered(String id);

    boolean markAsIgnored(String id);

    void clearAll();
}
