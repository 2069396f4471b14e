package com.abba.answerdesk.domain.service;

import com.abba.answerdesk.domain.model.RawMessage;

import java.util.List;

// fetchMessages and sendMessage report provider failures through their return value, never by throwing.
public interface PlatformConnector {

    String platform();

    boolean connect();

    List<RawMessage> fetchMessages();

    boolean sendMessage(String recipient, String content);

    boolean isConnected();

    String lastError();

    long requestCount();
}
