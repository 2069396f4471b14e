package com.abba.answerdesk.domain.service;

import com.abba.answerdesk.domain.model.Response;
import com.abba.answerdesk.domain.model.ResponseType;

import java.util.List;
import java.util.Optional;

public interface ResponseService {

    Response saveResponse(String messageId, String content, ResponseType type);

    Optional<Response> findById(String id);

    List<Response> findByMessageId(String messageId);

    Optional<Response> updateContent(String id, String content);

    Optional<Response> markAsSent(String id);
}
