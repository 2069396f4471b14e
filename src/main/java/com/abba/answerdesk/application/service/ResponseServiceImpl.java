package com.abba.answerdesk.application.service;

import com.abba.answerdesk.domain.exception.PersistenceException;
import com.abba.answerdesk.domain.model.Response;
import com.abba.answerdesk.domain.model.ResponseType;
import com.abba.answerdesk.domain.repository.MessageRepository;
import com.abba.answerdesk.domain.repository.ResponseRepository;
import com.abba.answerdesk.domain.service.ResponseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class ResponseServiceImpl implements ResponseService {

    private final ResponseRepository responseRepository;
    private final MessageRepository messageRepository;
    private final Clock clock;

    @Override
    public Response saveResponse(String messageId, String content, ResponseType type) {
        boolean messageExists = persist("look up message " + messageId, () -> messageRepository.existsById(messageId));
        if (!messageExists) {
            throw new IllegalArgumentException("Message not found: " + messageId);
        }
        Response response = Response.of(messageId, content, type);
        response.setGeneratedAt(OffsetDateTime.now(clock));
        Response saved = persist("save response for message " + messageId, () -> responseRepository.save(response));
        log.info("Saved {} response id={} for message {}", type, saved.getId(), messageId);
        return saved;
    }

    @Override
    public Optional<Response> findById(String id) {
        return persist("load response " + id, () -> responseRepository.findById(id));
    }

    @Override
    public List<Response> findByMessageId(String messageId) {
        return persist("load responses of message " + messageId,
                () -> responseRepository.findByMessageIdOrderByGeneratedAtAsc(messageId));
    }

    @Override
    public Optional<Response> updateContent(String id, String content) {
        return findById(id).map(response -> {
            response.setContent(content);
            return persist("update response " + id, () -> responseRepository.save(response));
        });
    }

    @Override
    public Optional<Response> markAsSent(String id) {
        Optional<Response> found = findById(id);
        if (found.isEmpty()) {
            log.warn("Response {} not found, cannot mark as sent", id);
            return Optional.empty();
        }
        Response response = found.get();
        if (!response.markAsSent(OffsetDateTime.now(clock))) {
            log.warn("Response {} was already sent at {}", id, response.getSentAt());
            return Optional.empty();
        }
        return Optional.of(persist("mark response " + id + " as sent", () -> responseRepository.save(response)));
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
