package com.abba.answerdesk.application.service;

import com.abba.answerdesk.domain.exception.PersistenceException;
import com.abba.answerdesk.domain.model.Message;
import com.abba.answerdesk.domain.model.MessageCategory;
import com.abba.answerdesk.domain.model.MessageStatus;
import com.abba.answerdesk.domain.model.RawMessage;
import com.abba.answerdesk.domain.repository.MessageRepository;
import com.abba.answerdesk.domain.repository.ResponseRepository;
import com.abba.answerdesk.domain.service.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class MessageServiceImpl implements MessageService {

    private final MessageRepository messageRepository;
    private final ResponseRepository responseRepository;

    @Override
    public Message receiveMessage(RawMessage rawMessage, MessageCategory category) {
        Message message = new Message();
        message.setPlatform(rawMessage.platform());
        message.setExternalId(rawMessage.externalId());
        message.setSender(rawMessage.sender());
        message.setReplyTo(rawMessage.replyTo() != null ? rawMessage.replyTo() : rawMessage.sender());
        message.setContent(rawMessage.content());
        message.setCategory(category);
        message.setStatus(MessageStatus.PENDING);
        message.setReceivedAt(rawMessage.timestamp() != null ? rawMessage.timestamp() : OffsetDateTime.now());
        Message saved = persist("add message from " + rawMessage.platform(), () -> messageRepository.save(message));
        log.info("Added new message id={} from {} on {} category={}", saved.getId(), saved.getSender(),
                saved.getPlatform(), category);
        return saved;
    }

    @Override
    public boolean isAlreadyReceived(String platform, String externalId) {
        if (externalId == null) {
            return false;
        }
        return persist("look up message", () -> messageRepository.existsByPlatformAndExternalId(platform, externalId));
    }

    @Override
    public Optional<Message> findById(String id) {
        return persist("load message " + id, () -> messageRepository.findById(id));
    }

    @Override
    public Optional<Message> getNextPendingMessage() {
        return persist("load next pending message",
                () -> messageRepository.findFirstByStatusOrderByReceivedAtAsc(MessageStatus.PENDING));
    }

    @Override
    public List<Message> getPendingMessages() {
        return persist("load pending messages",
                () -> messageRepository.findByStatusOrderByReceivedAtAsc(MessageStatus.PENDING));
    }

    @Override
    public boolean markAsProcessing(String id) {
        return transition(id, MessageStatus.PROCESSING, Message::markAsProcessing);
    }

    @Override
    public boolean markAsAnswered(String id) {
        return transition(id, MessageStatus.ANSWERED, Message::markAsAnswered);
    }

    @Override
    public boolean markAsIgnored(String id) {
        return transition(id, MessageStatus.IGNORED, Message::markAsIgnored);
    }

    @Override
    public void clearAll() {
        persist("clear storage", () -> {
            responseRepository.deleteAll();
            messageRepository.deleteAll();
            return null;
        });
        log.info("Local storage cleared");
    }

    private boolean transition(String id, MessageStatus target, Predicate<Message> change) {
        Optional<Message> message = findById(id);
        if (message.isEmpty()) {
            log.warn("Message {} not found, cannot mark as {}", id, target);
            return false;
        }
        Message current = message.get();
        if (!change.test(current)) {
            log.warn("Message {} cannot move from {} to {}", id, current.getStatus(), target);
            return false;
        }
        persist("mark message " + id + " as " + target, () -> messageRepository.save(current));
        return true;
    }

    private <T> T persist(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Persistence failure while trying to {}: {}", operation, e.getMessage());
            throw new PersistenceException("Failed to " + operation, e);
        }
    }
}
