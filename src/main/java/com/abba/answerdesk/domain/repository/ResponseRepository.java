package com.abba.answerdesk.domain.repository;

import com.abba.answerdesk.domain.model.Response;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ResponseRepository extends MongoRepository<Response, String> {

    List<Response> findByMessageIdOrderByGeneratedAtAsc(String messageId);

}
