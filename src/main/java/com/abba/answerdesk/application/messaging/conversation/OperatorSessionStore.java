package com.abba.answerdesk.application.messaging.conversation;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class OperatorSessionStore {

    private final Map<String, OperatorSession> sessions = new ConcurrentHashMap<>();

    public OperatorSession get(String operatorId) {
        return sessions.getOrDefault(operatorId, OperatorSession.idle());
    }

    public void put(String operatorId, OperatorSession session) {
        if (session.isIdle()) {
            sessions.remove(operatorId);
        } else {
            sessions.put(operatorId, session);
        }
    }

    public void reset(String operatorId) {
        sessions.remove(operatorId);
    }
}
