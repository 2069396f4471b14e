package com.abba.answerdesk.domain.repository;

import com.abba.answerdesk.domain.model.Message;
import com.abba.answerdesk.domain.model.MessageStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface MessageRepository extends MongoRepository<Message, String> {

    List<Message> findByStatusOrderByReceivedAtAsc(MessageStatus status);

    Optional<Message> findFirstByStatusOrderByReceivedAtAsc(MessageStatus status);

    boolean existsByPlatformAndExternalId(String platform, String externalId);

}
